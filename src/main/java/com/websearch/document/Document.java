package com.websearch.document;

/**
 * 已分配 docId 的文档。
 *
 * @param docId 按语料遍历顺序从 0 递增分配的文档 ID
 * @param url 页面 URL
 * @param source 语料目录下的相对路径（统一使用 / 分隔）
 */
public record Document(int docId, String url, String source) {

    public Document {
        if (docId < 0) {
            throw new IllegalArgumentException("docId不能为负数: " + docId);
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url不能为空, docId=" + docId);
        }
        if (source == null || source.isEmpty()) {
            throw new IllegalArgumentException("source不能为空, docId=" + docId);
        }
    }
}
