package com.websearch.storage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 部分段文件缺失、截断或校验失败。合并阶段遇到该异常必须中止，不得产出最终索引。
 */
public class SegmentIOException extends IOException {
    private final Path segmentFile;

    public SegmentIOException(Path segmentFile, String message) {
        super(message + ": " + segmentFile);
        this.segmentFile = segmentFile;
    }

    public SegmentIOException(Path segmentFile, String message, Throwable cause) {
        super(message + ": " + segmentFile, cause);
        this.segmentFile = segmentFile;
    }

    public Path getSegmentFile() {
        return segmentFile;
    }
}
