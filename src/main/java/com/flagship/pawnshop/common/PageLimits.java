package com.flagship.pawnshop.common;

import com.flagship.pawnshop.config.PawnshopProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

/**
 * Turns the API's skip/limit query parameters into a {@link Pageable},
 * applying the configured default and ceiling for limit.
 */
@Component
@RequiredArgsConstructor
public class PageLimits {

    private final PawnshopProperties properties;

    public Pageable of(Integer skip, Integer limit, Sort sort) {
        PawnshopProperties.Pagination pagination = properties.getPagination();
        int effectiveLimit = limit == null ? pagination.getDefaultLimit() : limit;
        if (effectiveLimit < 1 || effectiveLimit > pagination.getMaxLimit()) {
            throw new IllegalArgumentException(
                "limit must be between 1 and " + pagination.getMaxLimit());
        }
        return new OffsetPageRequest(skip == null ? 0 : skip, effectiveLimit, sort);
    }

    public Pageable of(Integer skip, Integer limit) {
        return of(skip, limit, Sort.by(Sort.Direction.DESC, "createdAt"));
    }
}
