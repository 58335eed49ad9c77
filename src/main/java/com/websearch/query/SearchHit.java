package com.websearch.query;

public record SearchHit(
        int docId,
        String url,
        double score
) {
}
