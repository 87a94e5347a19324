package net.gaiming.application.recommendation.query;

import java.util.List;

/**
 * One page of a larger result.
 *
 * @param page       1-based page number
 * @param totalCount matches across all pages
 */
public record PagedResult<T>(List<T> items, int page, int pageSize, long totalCount) {

    public PagedResult {
        items = List.copyOf(items);
    }

    public int totalPages() {
        return (int) ((totalCount + pageSize - 1) / pageSize);
    }

    public boolean hasNext() {
        return page < totalPages();
    }
}
