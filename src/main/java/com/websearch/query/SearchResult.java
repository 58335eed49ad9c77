package com.websearch.query;

import java.util.List;

public record SearchResult(
        String query,
        QueryMode mode,
        List<SearchHit> hits,
        int totalMatches,
        long elapsedMs
) {
    public static SearchResult empty(String query, QueryMode mode, long elapsedMs) {
        return new SearchResult(query, mode, List.of(), 0, elapsedMs);
    }
}
