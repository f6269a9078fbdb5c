package com.example.netorchestrator.persistence;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;

/**
 * Page request addressed by row offset instead of page number, for skip/limit listings
 * where skip need not be a multiple of limit.
 */
class OffsetPageRequest extends PageRequest {

    private final long offset;

    OffsetPageRequest(long offset, int limit, Sort sort) {
        super(0, limit, sort);
        if (offset < 0) {
            throw new IllegalArgumentException("Offset must not be negative");
        }
        this.offset = offset;
    }

    @Override
    public long getOffset() {
        return offset;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof OffsetPageRequest)) {
            return false;
        }
        return offset == ((OffsetPageRequest) obj).offset && super.equals(obj);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + Long.hashCode(offset);
    }
}
