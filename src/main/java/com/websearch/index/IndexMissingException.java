package com.websearch.index;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 索引目录中没有已提交的索引。
 */
public class IndexMissingException extends IOException {
    private final Path indexDir;

    public IndexMissingException(Path indexDir) {
        super("索引不存在或尚未完成构建: " + indexDir);
        this.indexDir = indexDir;
    }

    public Path getIndexDir() {
        return indexDir;
    }
}
