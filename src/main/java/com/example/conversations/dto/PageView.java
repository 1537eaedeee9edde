package com.example.conversations.dto;

import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.IntFunction;

/**
 * One page of a filtered listing.
 *
 * @param count    total number of items after filtering, across all pages
 * @param next     link to the following page, or {@code null} on the last page
 * @param previous link to the preceding page, or {@code null} on the first page
 * @param results  items of the requested page, in order
 */
public record PageView<T>(long count, String next, String previous, List<T> results) {

    /**
     * Builds the view from a Spring Data page. Links are only produced for pages that
     * exist: a request past the end gets a {@code previous} link to the last page.
     *
     * @param page        0-based Spring Data page
     * @param linkForPage renders the link for a 1-based page number
     */
    public static <T> PageView<T> of(Page<T> page, IntFunction<String> linkForPage) {
        int current = page.getNumber() + 1;
        int totalPages = page.getTotalPages();

        String next = current < totalPages ? linkForPage.apply(current + 1) : null;
        String previous = null;
        if (current > 1 && totalPages > 0) {
            previous = linkForPage.apply(Math.min(current - 1, totalPages));
        }
        return new PageView<>(page.getTotalElements(), next, previous, page.getContent());
    }
}
