package com.polishfootball.network.application.dto;

import java.util.List;

public record PagedResult<T>(
        List<T> items,
        long totalCount,
        int page,
        int pageSize,
        int totalPages,
        boolean hasNextPage,
        boolean hasPreviousPage
) {
    public static <T> PagedResult<T> of(List<T> items, long totalCount, int page, int pageSize) {
        int totalPages = (int) ((totalCount + pageSize - 1) / pageSize);
        return new PagedResult<>(
                List.copyOf(items),
                totalCount,
                page,
                pageSize,
                totalPages,
                page < totalPages,
                page > 1
        );
    }

    /**
     * Slices an in-memory list into the requested page.
     */
    public static <T> PagedResult<T> slice(List<T> all, int page, int pageSize) {
        int from = (int) Math.min((long) (page - 1) * pageSize, all.size());
        int to = Math.min(from + pageSize, all.size());
        return of(all.subList(from, to), all.size(), page, pageSize);
    }
}
