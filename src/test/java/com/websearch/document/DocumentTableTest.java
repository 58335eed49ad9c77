package com.websearch.document;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DocumentTableTest {
    @TempDir
    Path tempDir;

    @Test
    void testReplaceAllAndFind() {
        Path dbPath = tempDir.resolve("documents.db");

        try (DocumentTable documentTable = new DocumentTable(dbPath)) {
            documentTable.replaceAll(List.of(
                new Document(0, "https://example.edu/a", "a.json"),
                new Document(1, "https://example.edu/b", "b.json")));

            Optional<Document> loaded = documentTable.findById(1);
            assertTrue(loaded.isPresent());
            assertEquals("https://example.edu/b", loaded.get().url());
            assertEquals("b.json", loaded.get().source());
            assertFalse(documentTable.findById(7).isPresent());
            assertEquals(2, documentTable.count());
        }
    }

    @Test
    void testFindAllIsOrderedAndPersistent() {
        Path dbPath = tempDir.resolve("documents.db");
        List<Document> documents = List.of(
            new Document(2, "https://c", "c.json"),
            new Document(0, "https://a", "a.json"),
            new Document(1, "https://b", "b.json")
        );

        try (DocumentTable documentTable = new DocumentTable(dbPath)) {
            documentTable.replaceAll(documents);
        }
        try (DocumentTable reopened = new DocumentTable(dbPath)) {
            List<Document> loaded = reopened.findAll();
            assertEquals(List.of(0, 1, 2), loaded.stream().map(Document::docId).toList());
            assertEquals("https://c", loaded.get(2).url());
        }
    }

    @Test
    void testReplaceAllDropsPreviousRows() {
        Path dbPath = tempDir.resolve("documents.db");

        try (DocumentTable documentTable = new DocumentTable(dbPath)) {
            documentTable.replaceAll(List.of(new Document(0, "https://old", "old.json"), new Document(1, "https://x", "x.json")));
            documentTable.replaceAll(List.of(new Document(0, "https://new", "new.json")));

            assertEquals(List.of(new Document(0, "https://new", "new.json")), documentTable.findAll());
        }
    }

    @Test
    void testFailedReplaceKeepsPreviousRows() {
        Path dbPath = tempDir.resolve("documents.db");

        try (DocumentTable documentTable = new DocumentTable(dbPath)) {
            documentTable.replaceAll(List.of(new Document(0, "https://kept", "kept.json")));
            List<Document> duplicates = List.of(
                new Document(0, "https://a", "a.json"),
                new Document(0, "https://dup", "dup.json")
            );

            assertThrows(IllegalStateException.class, () -> documentTable.replaceAll(duplicates));
            assertEquals(1, documentTable.count());
            assertEquals("https://kept", documentTable.findById(0).orElseThrow().url());
        }
    }

    @Test
    void testDocumentValidation() {
        assertThrows(IllegalArgumentException.class, () -> new Document(-1, "https://a", "a.json"));
        assertThrows(IllegalArgumentException.class, () -> new Document(0, " ", "a.json"));
        assertThrows(IllegalArgumentException.class, () -> new Document(0, "https://a", null));
    }
}
