package com.sportsync.resolution.api;

import java.util.List;

/**
 * One page of a listing such as the pending review queue.
 *
 * @param content       items on this page
 * @param totalElements total number of items across all pages
 * @param pageNumber    zero-based page number
 * @param pageSize      requested page size
 */
public record Page<T>(List<T> content, long totalElements, int pageNumber, int pageSize) {

    public Page {
        content = content != null ? List.copyOf(content) : List.of();
        if (totalElements < 0) {
            throw new IllegalArgumentException("totalElements must be >= 0");
        }
    }

    public boolean hasNext() {
        return (long) (pageNumber + 1) * pageSize < totalElements;
    }

    public int totalPages() {
        return pageSize == 0 ? 0 : (int) Math.ceil((double) totalElements / pageSize);
    }

    /**
     * Cuts the requested page out of an already ordered list.
     */
    public static <T> Page<T> slice(List<T> ordered, PageRequest request) {
        int total = ordered.size();
        int from = Math.min(request.offset(), total);
        int to = Math.min(request.offset() + request.limit(), total);
        return new Page<>(ordered.subList(from, to), total, request.pageNumber(), request.limit());
    }

    public static <T> Page<T> empty(PageRequest request) {
        return new Page<>(List.of(), 0, request.pageNumber(), request.limit());
    }
}
