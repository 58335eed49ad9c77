package com.websearch.index;

import java.nio.file.Path;
import java.time.Instant;

/**
 * 已提交索引的状态快照。
 */
public record IndexStatus(
    Path indexDir,
    int docCount,
    int termCount,
    long postingCount,
    int segmentCount,
    int skippedDocuments,
    long indexSizeBytes,
    Instant createdAt
) {
}
