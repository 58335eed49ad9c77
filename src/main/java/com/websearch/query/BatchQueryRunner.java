package com.websearch.query;

import com.websearch.config.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 按顺序执行一组查询，结果以查询文本为键保持输入顺序。
 */
public class BatchQueryRunner {
    private static final Logger logger = LoggerFactory.getLogger(BatchQueryRunner.class);

    private final QueryEngine queryEngine;

    public BatchQueryRunner(QueryEngine queryEngine) {
        if (queryEngine == null) {
            throw new IllegalArgumentException("queryEngine 不能为空");
        }
        this.queryEngine = queryEngine;
    }

    /**
     * 执行固定的基准查询集合。
     */
    public Map<String, SearchResult> runCanonical(QueryMode mode, int topK) throws IOException {
        return run(Constants.CANONICAL_QUERIES, mode, topK);
    }

    /**
     * 执行给定查询，重复的查询文本只保留一次结果。
     *
     * @param queries 查询文本列表
     * @param mode 组合方式
     * @param topK 每个查询的结果上限
     * @return 查询文本 → 结果（按输入顺序）
     * @throws IOException 读取索引失败时抛出
     */
    public Map<String, SearchResult> run(List<String> queries, QueryMode mode, int topK) throws IOException {
        if (queries == null) {
            throw new IllegalArgumentException("查询列表不能为空");
        }
        Map<String, SearchResult> results = new LinkedHashMap<>();
        for (String query : queries) {
            if (results.containsKey(query)) {
                continue;
            }
            SearchResult result = queryEngine.search(query, mode, topK);
            logger.info("批量查询: \"{}\" -> {} 条匹配, {}ms", query, result.totalMatches(), result.elapsedMs());
            results.put(query, result);
        }
        return results;
    }
}
