package com.websearch.index;

/**
 * 一次 k 路合并的统计。
 *
 * @param segmentCount 参与合并的段数
 * @param termCount 输出的不同词项数
 * @param postingCount 输出的倒排项数（重复 docId 合并后）
 * @param segmentPostingCount 从各段读出的倒排项总数
 * @param totalWeight 输出的加权词频总和
 */
public record MergeStats(int segmentCount, int termCount, long postingCount, long segmentPostingCount, long totalWeight) {
}
