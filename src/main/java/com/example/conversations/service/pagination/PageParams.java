package com.example.conversations.service.pagination;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

/**
 * Page number (1-based) and page size requested by a client.
 *
 * <p>Raw query values are parsed leniently: an absent, non-numeric or non-positive
 * value falls back to the default instead of failing the request.</p>
 *
 * @param page     1-based page number
 * @param pageSize number of items per page
 */
public record PageParams(int page, int pageSize) {

    public static final int FIRST_PAGE = 1;

    public PageParams {
        if (page < FIRST_PAGE) {
            throw new IllegalArgumentException("page must be >= 1, got " + page);
        }
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be >= 1, got " + pageSize);
        }
    }

    /**
     * @param rawPage         {@code page} query parameter, may be {@code null}
     * @param rawPageSize     {@code page_size} query parameter, may be {@code null}
     * @param defaultPageSize size used when {@code rawPageSize} is unusable
     */
    public static PageParams parse(String rawPage, String rawPageSize, int defaultPageSize) {
        return new PageParams(
                positiveOrDefault(rawPage, FIRST_PAGE),
                positiveOrDefault(rawPageSize, defaultPageSize));
    }

    public Pageable toPageable() {
        return PageRequest.of(page - 1, pageSize);
    }

    /**
     * Position of the first item of this page in the full listing.
     */
    public long offset() {
        return (long) (page - 1) * pageSize;
    }

    /**
     * Whether {@link #offset()} fits a JPA row offset. Pages past that limit are
     * necessarily beyond the last item.
     */
    public boolean isAddressable() {
        return offset() <= Integer.MAX_VALUE;
    }

    private static int positiveOrDefault(String raw, int fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            return value >= 1 ? value : fallback;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
