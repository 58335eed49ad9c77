package com.websearch.query;

import com.websearch.document.Document;
import com.websearch.index.IndexStore;
import com.websearch.scoring.TfIdfScorer;
import com.websearch.storage.IndexMeta;
import com.websearch.storage.PostingList;
import com.websearch.text.Normalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * TF-IDF 查询引擎：解析 → 规范化 → 取倒排 → AND/OR 组合 → 打分 → 排序 → 截断。
 *
 * <p>引擎只持有不可变的 {@link IndexStore}，可被多个线程并发调用。
 */
public class QueryEngine {
    private static final Logger logger = LoggerFactory.getLogger(QueryEngine.class);

    /** 分数降序，分数相同按 docId 升序 */
    static final Comparator<ScoredDoc> RANKING = Comparator
        .comparingDouble(ScoredDoc::score).reversed()
        .thenComparingInt(ScoredDoc::docId);

    private final IndexStore indexStore;
    private final QueryParser queryParser;
    private final TfIdfScorer scorer;

    /**
     * 使用构建索引时记录的规范化设置创建引擎，保证查询词与索引词一致。
     */
    public QueryEngine(IndexStore indexStore) {
        this(indexStore, normalizerFor(indexStore.meta()));
    }

    public QueryEngine(IndexStore indexStore, Normalizer normalizer) {
        if (indexStore == null) {
            throw new IllegalArgumentException("indexStore 不能为空");
        }
        this.indexStore = indexStore;
        this.queryParser = new QueryParser(normalizer);
        this.scorer = new TfIdfScorer(indexStore.totalDocuments());
    }

    public SearchResult search(String queryString, QueryMode mode, int topK) throws IOException {
        return search(queryParser.parse(queryString, mode, topK));
    }

    /**
     * 执行已解析的查询。
     *
     * @param query 查询
     * @return 结果（无命中时 hits 为空）
     * @throws IOException 读取倒排失败时抛出
     */
    public SearchResult search(Query query) throws IOException {
        long startNanos = System.nanoTime();
        if (query.isEmpty()) {
            return SearchResult.empty(query.text(), query.mode(), elapsedMs(startNanos));
        }

        Map<String, Integer> occurrencesByTerm = new LinkedHashMap<>();
        for (String term : query.terms()) {
            occurrencesByTerm.merge(term, 1, Integer::sum);
        }

        List<TermPostings> fetched = new ArrayList<>(occurrencesByTerm.size());
        for (Map.Entry<String, Integer> entry : occurrencesByTerm.entrySet()) {
            int docFrequency = indexStore.docFrequency(entry.getKey());
            if (docFrequency == 0) {
                if (query.mode() == QueryMode.AND) {
                    return SearchResult.empty(query.text(), query.mode(), elapsedMs(startNanos));
                }
                continue;
            }
            PostingList postings = indexStore.lookup(entry.getKey());
            fetched.add(new TermPostings(postings, docFrequency, entry.getValue()));
        }

        List<ScoredDoc> candidates = query.mode() == QueryMode.AND ? intersect(fetched) : union(fetched);
        candidates.sort(RANKING);

        int limit = Math.min(query.topK(), candidates.size());
        List<SearchHit> hits = new ArrayList<>(limit);
        for (ScoredDoc candidate : candidates.subList(0, limit)) {
            Document document = indexStore.resolve(candidate.docId());
            hits.add(new SearchHit(candidate.docId(), document.url(), candidate.score()));
        }

        long elapsedMs = elapsedMs(startNanos);
        logger.debug("查询完成: query=\"{}\", mode={}, matches={}, elapsed={}ms",
            query.text(), query.mode(), candidates.size(), elapsedMs);
        return new SearchResult(query.text(), query.mode(), hits, candidates.size(), elapsedMs);
    }

    /**
     * 以最短倒排为驱动求交集，其余倒排用二分查找确认。
     */
    private List<ScoredDoc> intersect(List<TermPostings> fetched) {
        if (fetched.isEmpty()) {
            return new ArrayList<>();
        }
        TermPostings driver = fetched.get(0);
        for (TermPostings candidate : fetched) {
            if (candidate.postings().size() < driver.postings().size()) {
                driver = candidate;
            }
        }
        List<ScoredDoc> matches = new ArrayList<>();
        PostingList driverPostings = driver.postings();
        for (int index = 0; index < driverPostings.size(); index++) {
            int docId = driverPostings.docId(index);
            double score = 0.0;
            boolean matchedAll = true;
            for (TermPostings termPostings : fetched) {
                int position = termPostings.postings().indexOf(docId);
                if (position < 0) {
                    matchedAll = false;
                    break;
                }
                score += contribution(termPostings, termPostings.postings().weight(position));
            }
            if (matchedAll) {
                matches.add(new ScoredDoc(docId, score));
            }
        }
        return matches;
    }

    private List<ScoredDoc> union(List<TermPostings> fetched) {
        Map<Integer, Double> scores = new HashMap<>();
        for (TermPostings termPostings : fetched) {
            PostingList postings = termPostings.postings();
            for (int index = 0; index < postings.size(); index++) {
                scores.merge(postings.docId(index), contribution(termPostings, postings.weight(index)), Double::sum);
            }
        }
        List<ScoredDoc> matches = new ArrayList<>(scores.size());
        for (Map.Entry<Integer, Double> entry : scores.entrySet()) {
            matches.add(new ScoredDoc(entry.getKey(), entry.getValue()));
        }
        return matches;
    }

    /**
     * 查询词在单个文档上的得分：出现次数 × 加权词频 × idf。
     */
    private double contribution(TermPostings termPostings, int weight) {
        return termPostings.occurrences() * scorer.score(weight, termPostings.docFrequency());
    }

    private static Normalizer normalizerFor(IndexMeta meta) {
        return new Normalizer(meta.fieldWeights(), meta.stopWordsEnabled());
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    /**
     * @param occurrences 查询词在查询中出现的次数
     */
    private record TermPostings(PostingList postings, int docFrequency, int occurrences) {
    }

    record ScoredDoc(int docId, double score) {
    }
}
