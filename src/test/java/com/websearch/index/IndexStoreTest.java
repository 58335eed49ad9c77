package com.websearch.index;

import com.websearch.CorpusFixtures;
import com.websearch.config.EngineConfig;
import com.websearch.document.Document;
import com.websearch.document.DocumentMap;
import com.websearch.document.UnknownDocIdException;
import com.websearch.storage.IndexMeta;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IndexStoreTest {

    @TempDir
    Path tempDir;

    private Path corpusDir;
    private Path indexDir;

    @BeforeEach
    void buildIndex() throws IOException {
        corpusDir = tempDir.resolve("corpus");
        indexDir = tempDir.resolve("index");
        CorpusFixtures.writeMachineLearningCorpus(corpusDir);
        EngineConfig config = EngineConfig.defaults();
        config.setIndexDir(indexDir);
        config.setIndexThreads(2);
        config.setSegmentMaxDocs(1);
        new IndexBuilder(config).build(corpusDir);
    }

    @Test
    void testLookupAndResolve() throws IOException {
        try (IndexStore store = IndexStore.open(indexDir)) {
            assertEquals(3, store.totalDocuments());
            assertEquals(2, store.docFrequency("learn"));
            assertEquals(List.of(0, 1), toList(store.lookup("learn").docIds()));
            assertEquals(6, store.lookup("learn").weightOf(0));
            assertEquals(1, store.lookup("learn").weightOf(1));
            assertEquals(0, store.docFrequency("zebra"));
            assertTrue(store.lookup("zebra").isEmpty());

            assertEquals("https://example.edu/ml", store.resolve(0).url());
            assertEquals("a/page1.json", store.resolve(1).source());
            assertThrows(UnknownDocIdException.class, () -> store.resolve(3));
        }
    }

    @Test
    void testStatus() throws IOException {
        try (IndexStore store = IndexStore.open(indexDir)) {
            IndexStatus status = store.status();
            assertEquals(3, status.docCount());
            assertEquals(store.meta().termCount(), status.termCount());
            assertEquals(3, status.segmentCount());
            assertTrue(status.indexSizeBytes() > 0);
        }
    }

    @Test
    void testMissingIndex() {
        IndexMissingException exception = assertThrows(IndexMissingException.class,
            () -> IndexStore.open(tempDir.resolve("nothing")));
        assertEquals(tempDir.resolve("nothing").toAbsolutePath().normalize(), exception.getIndexDir());
    }

    @Test
    void testUncommittedIndexIsInvisible() throws IOException {
        Files.delete(indexDir.resolve("index.json"));

        assertThrows(IndexMissingException.class, () -> IndexStore.open(indexDir));
    }

    @Test
    void testMissingDocMapWithoutCorpusFails() throws IOException {
        Files.delete(indexDir.resolve("documents.db"));

        IOException exception = assertThrows(IOException.class, () -> IndexStore.open(indexDir));
        assertTrue(exception.getMessage().contains("rebuild-docmap"));
    }

    @Test
    void testDocMapRebuildReproducesOriginal() throws IOException {
        List<Document> original;
        try (IndexStore store = IndexStore.open(indexDir)) {
            original = store.documentMap().documents();
        }
        Files.delete(indexDir.resolve("documents.db"));

        try (IndexStore store = IndexStore.open(indexDir, corpusDir)) {
            assertEquals(original, store.documentMap().documents());
        }
        assertEquals(original, DocumentMap.load(indexDir.resolve("documents.db")).documents());
    }

    @Test
    void testDocMapRebuildRejectsChangedCorpus() throws IOException {
        Files.delete(indexDir.resolve("documents.db"));
        CorpusFixtures.writePage(corpusDir, "a/extra.json", "https://example.edu/extra", "<p>extra</p>");
        Files.delete(corpusDir.resolve("b/page2.json"));

        IndexMeta meta = IndexStore.readMeta(indexDir);
        assertThrows(IOException.class, () -> DocumentMapRebuilder.rebuild(new IndexLayout(indexDir), meta, corpusDir));
        assertTrue(Files.notExists(indexDir.resolve("documents.db")));
    }

    @Test
    void testInconsistentDocMapIsRejected() throws IOException {
        DocumentMap.of(List.of(new Document(0, "https://only", "only.json"))).writeTo(tempDir.resolve("other.db"));
        Files.copy(tempDir.resolve("other.db"), indexDir.resolve("documents.db"),
            java.nio.file.StandardCopyOption.REPLACE_EXISTING);

        assertThrows(IOException.class, () -> IndexStore.open(indexDir));
    }

    private static List<Integer> toList(int[] values) {
        return java.util.Arrays.stream(values).boxed().toList();
    }
}
