package com.websearch.index;

import com.websearch.config.EngineConfig;

/**
 * 部分段刷写阈值，任一阈值为 0 表示不按该维度刷写。
 *
 * @param maxDocs 缓冲文档数上限
 * @param maxTerms 缓冲不同词项数上限
 * @param maxBytes 估算内存字节上限
 */
public record FlushPolicy(int maxDocs, int maxTerms, long maxBytes) {

    public FlushPolicy {
        if (maxDocs < 0 || maxTerms < 0 || maxBytes < 0) {
            throw new IllegalArgumentException("刷写阈值不能为负数: maxDocs=" + maxDocs
                + ", maxTerms=" + maxTerms + ", maxBytes=" + maxBytes);
        }
    }

    /**
     * 仅在构建结束时刷写一次。
     */
    public static FlushPolicy unbounded() {
        return new FlushPolicy(0, 0, 0L);
    }

    public static FlushPolicy from(EngineConfig config) {
        return new FlushPolicy(config.getSegmentMaxDocs(), config.getSegmentMaxTerms(), config.getSegmentMaxBytes());
    }

    /**
     * 判断当前缓冲状态是否需要刷写。
     */
    public boolean shouldFlush(int bufferedDocs, int bufferedTerms, long estimatedBytes) {
        return (maxDocs > 0 && bufferedDocs >= maxDocs)
            || (maxTerms > 0 && bufferedTerms >= maxTerms)
            || (maxBytes > 0 && estimatedBytes >= maxBytes);
    }
}
