package com.websearch.index;

import java.nio.file.Path;

/**
 * 索引目录内的文件布局。
 *
 * <pre>
 * indexDir/
 *   segments/segment_000000.seg   部分段（构建期间）
 *   final_index.bin               最终倒排索引
 *   documents.db                  docId -&gt; URL 映射（SQLite）
 *   index.json                    提交标记与元数据
 * </pre>
 */
public final class IndexLayout {
    static final String SEGMENTS_DIR = "segments";
    static final String FINAL_INDEX = "final_index.bin";
    static final String DOCUMENTS_DB = "documents.db";
    static final String META_FILE = "index.json";
    private static final String STAGED_SUFFIX = ".new";

    private final Path indexDir;

    public IndexLayout(Path indexDir) {
        if (indexDir == null) {
            throw new IllegalArgumentException("索引目录不能为空");
        }
        this.indexDir = indexDir.toAbsolutePath().normalize();
    }

    public Path indexDir() {
        return indexDir;
    }

    public Path segmentsDir() {
        return indexDir.resolve(SEGMENTS_DIR);
    }

    public Path segmentFile(int segmentId) {
        return segmentsDir().resolve(segmentFileName(segmentId));
    }

    public Path finalIndex() {
        return indexDir.resolve(FINAL_INDEX);
    }

    public Path documentsDb() {
        return indexDir.resolve(DOCUMENTS_DB);
    }

    public Path metaFile() {
        return indexDir.resolve(META_FILE);
    }

    public Path stagedFinalIndex() {
        return indexDir.resolve(FINAL_INDEX + STAGED_SUFFIX);
    }

    public Path stagedDocumentsDb() {
        return indexDir.resolve(DOCUMENTS_DB + STAGED_SUFFIX);
    }

    static String segmentFileName(int segmentId) {
        return String.format("segment_%06d.seg", segmentId);
    }
}
