package com.websearch.query;

import com.websearch.CorpusFixtures;
import com.websearch.config.EngineConfig;
import com.websearch.index.IndexBuilder;
import com.websearch.index.IndexStore;
import com.websearch.scoring.TfIdfScorer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueryEngineTest {

    @TempDir
    Path tempDir;

    private IndexStore indexStore;

    @AfterEach
    void closeStore() throws IOException {
        if (indexStore != null) {
            indexStore.close();
        }
    }

    private QueryEngine openEngine(Path corpusDir) throws IOException {
        Path indexDir = tempDir.resolve("index");
        EngineConfig config = EngineConfig.defaults();
        config.setIndexDir(indexDir);
        config.setIndexThreads(2);
        new IndexBuilder(config).build(corpusDir);
        indexStore = IndexStore.open(indexDir);
        return new QueryEngine(indexStore);
    }

    private QueryEngine machineLearningEngine() throws IOException {
        Path corpusDir = tempDir.resolve("corpus");
        CorpusFixtures.writeMachineLearningCorpus(corpusDir);
        return openEngine(corpusDir);
    }

    @Test
    @DisplayName("AND 只返回同时包含全部查询词的文档")
    void testAndRequiresAllTerms() throws IOException {
        SearchResult result = machineLearningEngine().search("machine learning", QueryMode.AND, 5);

        assertEquals(List.of(0), docIds(result));
        assertEquals(1, result.totalMatches());
        assertEquals("https://example.edu/ml", result.hits().get(0).url());
        double expected = 6 * Math.log(3.0) + 6 * Math.log(1.5);
        assertEquals(expected, result.hits().get(0).score(), 1e-9);
    }

    @Test
    void testScoresComeFromTfIdfScorer() throws IOException {
        TfIdfScorer scorer = new TfIdfScorer(3);

        SearchResult result = machineLearningEngine().search("machine learning learning", QueryMode.OR, 5);

        assertEquals(scorer.score(6, 1) + 2 * scorer.score(6, 2), result.hits().get(0).score(), 1e-9);
        assertEquals(2 * scorer.score(1, 2), result.hits().get(1).score(), 1e-9);
    }

    @Test
    void testOrRanksByScore() throws IOException {
        SearchResult result = machineLearningEngine().search("machine learning", QueryMode.OR, 5);

        assertEquals(List.of(0, 1), docIds(result));
        assertTrue(result.hits().get(0).score() > result.hits().get(1).score());
        assertEquals(Math.log(1.5), result.hits().get(1).score(), 1e-9);
    }

    @Test
    void testSingleTermModesAgree() throws IOException {
        QueryEngine engine = machineLearningEngine();

        SearchResult and = engine.search("learning", QueryMode.AND, 5);
        SearchResult or = engine.search("learning", QueryMode.OR, 5);

        assertEquals(and.hits(), or.hits());
        assertEquals(List.of(0, 1), docIds(and));
    }

    @Test
    void testUnknownTerm() throws IOException {
        QueryEngine engine = machineLearningEngine();

        SearchResult and = engine.search("machine zebra", QueryMode.AND, 5);
        SearchResult or = engine.search("machine zebra", QueryMode.OR, 5);

        assertTrue(and.hits().isEmpty());
        assertEquals(0, and.totalMatches());
        assertEquals(List.of(0), docIds(or));
    }

    @Test
    void testEmptyQuerySucceedsWithNoHits() throws IOException {
        SearchResult result = machineLearningEngine().search("   ", QueryMode.AND, 5);

        assertTrue(result.hits().isEmpty());
        assertEquals(0, result.totalMatches());
    }

    @Test
    void testRepeatedTermMultipliesScore() throws IOException {
        QueryEngine engine = machineLearningEngine();

        double single = engine.search("learning", QueryMode.OR, 5).hits().get(0).score();
        double repeated = engine.search("learning learning", QueryMode.OR, 5).hits().get(0).score();

        assertEquals(2 * single, repeated, 1e-9);
    }

    @Test
    @DisplayName("同分文档按 docId 升序排列")
    void testTiesBrokenByDocId() throws IOException {
        Path corpusDir = tempDir.resolve("ties");
        for (int index = 0; index < 4; index++) {
            CorpusFixtures.writePage(corpusDir, "p" + index + ".json", "https://example.edu/t/" + index,
                CorpusFixtures.html("Page", "<p>alpha</p>"));
        }
        CorpusFixtures.writePage(corpusDir, "p4.json", "https://example.edu/t/4",
            CorpusFixtures.html("Page", "<p>beta</p>"));

        SearchResult result = openEngine(corpusDir).search("alpha", QueryMode.OR, 10);

        assertEquals(List.of(0, 1, 2, 3), docIds(result));
        assertEquals(result.hits().get(0).score(), result.hits().get(3).score());
    }

    @Test
    void testTopKTruncation() throws IOException {
        Path corpusDir = tempDir.resolve("numbered");
        CorpusFixtures.writeNumberedCorpus(corpusDir, 30);
        QueryEngine engine = openEngine(corpusDir);

        SearchResult full = engine.search("search index", QueryMode.OR, 1000);
        SearchResult top = engine.search("search index", QueryMode.OR, 3);

        assertTrue(full.totalMatches() > 3);
        assertEquals(full.totalMatches(), top.totalMatches());
        assertEquals(full.hits().subList(0, 3), top.hits());
        for (int index = 1; index < full.hits().size(); index++) {
            assertTrue(full.hits().get(index - 1).score() >= full.hits().get(index).score());
        }
    }

    @Test
    @DisplayName("topK 大于命中数时返回全部命中")
    void testTopKLargerThanMatchesReturnsAll() throws IOException {
        SearchResult result = machineLearningEngine().search("machine learning", QueryMode.OR, 5000);

        assertEquals(List.of(0, 1), docIds(result));
        assertEquals(2, result.totalMatches());
    }

    @Test
    void testConcurrentSearchesMatchSequential() throws Exception {
        Path corpusDir = tempDir.resolve("numbered");
        CorpusFixtures.writeNumberedCorpus(corpusDir, 50);
        QueryEngine engine = openEngine(corpusDir);
        List<String> queries = List.of("search", "ranking engines", "crawler query", "retrieval learning", "index");

        List<SearchResult> expected = new ArrayList<>();
        for (String query : queries) {
            expected.add(engine.search(query, QueryMode.OR, 10));
        }

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<SearchResult>> futures = new ArrayList<>();
            for (int round = 0; round < 20; round++) {
                for (String query : queries) {
                    futures.add(executor.submit(() -> engine.search(query, QueryMode.OR, 10)));
                }
            }
            for (int index = 0; index < futures.size(); index++) {
                assertEquals(expected.get(index % queries.size()).hits(), futures.get(index).get().hits());
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private static List<Integer> docIds(SearchResult result) {
        List<Integer> ids = new ArrayList<>();
        for (SearchHit hit : result.hits()) {
            ids.add(hit.docId());
        }
        return ids;
    }
}
