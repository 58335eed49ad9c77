package com.websearch.query;

import com.websearch.config.ConfigException;

import java.util.List;

/**
 * 已解析的查询。
 *
 * @param text 原始查询文本
 * @param terms 规范化后的查询词（保留顺序与重复）
 * @param mode 组合方式
 * @param topK 返回结果上限
 */
public record Query(String text, List<String> terms, QueryMode mode, int topK) {

    public Query {
        if (text == null) {
            throw new IllegalArgumentException("查询文本不能为null");
        }
        if (mode == null) {
            throw new ConfigException("查询模式不能为空");
        }
        if (topK <= 0) {
            throw new ConfigException("topK 必须为正数: " + topK);
        }
        terms = List.copyOf(terms);
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }
}
