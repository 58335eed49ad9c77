package com.websearch.storage;

import java.nio.file.Path;

/**
 * 已提交的部分段文件描述。
 *
 * @param segmentId 全局单调递增的段 ID
 * @param path 段文件路径
 * @param docCount 段内文档数
 * @param termCount 段内词项数
 * @param postingCount 段内倒排项总数
 */
public record SegmentFile(int segmentId, Path path, int docCount, int termCount, long postingCount) {
}
