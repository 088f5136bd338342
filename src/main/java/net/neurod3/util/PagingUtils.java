package net.neurod3.util;

import java.util.List;

/**
 * Lightweight helpers for common paging maths so controllers and services can
 * share the same clamping semantics without re-implementing them.
 */
public final class PagingUtils {

    private PagingUtils() {
        // Utility class
    }

    /**
     * Clamp {@code value} to the inclusive {@code [min, max]} range.
     */
    public static int clamp(int value, int min, int max) {
        if (min > max) {
            throw new IllegalArgumentException(min + " > " + max);
        }
        return Math.min(max, Math.max(min, value));
    }

    /**
     * Number of pages needed for {@code totalCount} items; never less than one so an empty
     * result still has a first page to show.
     */
    public static int totalPages(int totalCount, int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive but was " + pageSize);
        }
        if (totalCount <= 0) {
            return 1;
        }
        return (int) ((totalCount + (long) pageSize - 1) / pageSize);
    }

    /**
     * 1-based page number containing the zero-based {@code offset}.
     */
    public static int pageForOffset(int offset, int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive but was " + pageSize);
        }
        return Math.max(0, offset) / pageSize + 1;
    }

    /**
     * Zero-based offset of the first item on a 1-based {@code page}.
     */
    public static int offsetForPage(int page, int pageSize) {
        long offset = (long) (Math.max(1, page) - 1) * Math.max(0, pageSize);
        return (int) Math.min(Integer.MAX_VALUE, offset);
    }

    /**
     * Produce a defensive slice of {@code items} using the provided {@code startIndex} and {@code limit}.
     * Always returns a new list, never throws on bounds issues, and gracefully handles null/empty inputs.
     */
    public static <T> List<T> slice(List<T> items, int startIndex, int limit) {
        if (items == null || items.isEmpty() || limit <= 0) {
            return List.of();
        }
        int safeStart = Math.max(0, startIndex);
        int boundedStart = Math.min(safeStart, items.size());
        int boundedEnd = (int) Math.min((long) boundedStart + limit, items.size());
        if (boundedStart >= boundedEnd) {
            return List.of();
        }
        return List.copyOf(items.subList(boundedStart, boundedEnd));
    }
}
