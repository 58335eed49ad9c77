package com.websearch.query;

import com.websearch.config.ConfigException;
import com.websearch.config.Constants;
import com.websearch.text.Normalizer;

/**
 * 将原始查询文本解析为 {@link Query}，查询词与索引使用同一套规范化规则。
 */
public class QueryParser {
    private final Normalizer normalizer;

    public QueryParser(Normalizer normalizer) {
        if (normalizer == null) {
            throw new IllegalArgumentException("normalizer 不能为空");
        }
        this.normalizer = normalizer;
    }

    /**
     * 解析查询。
     *
     * @param rawQuery 原始查询文本，null 视为空查询
     * @param mode 组合方式
     * @param topK 返回结果上限
     * @return 查询对象，所有词都被过滤时 terms 为空
     * @throws ConfigException 查询过长、topK 或模式非法时抛出
     */
    public Query parse(String rawQuery, QueryMode mode, int topK) {
        String text = rawQuery == null ? "" : rawQuery.trim();
        if (text.length() > Constants.MAX_QUERY_LENGTH) {
            throw new ConfigException("查询长度超过限制（最大 " + Constants.MAX_QUERY_LENGTH + " 字符）: " + text.length());
        }
        return new Query(text, normalizer.normalizeQuery(text), mode, topK);
    }
}
