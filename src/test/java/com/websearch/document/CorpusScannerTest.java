package com.websearch.document;

import com.websearch.CorpusFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CorpusScannerTest {

    @TempDir
    Path corpusDir;

    @Test
    void testTraversalOrderIsSortedRelativePath() throws IOException {
        CorpusFixtures.writePage(corpusDir, "b/x.json", "https://b/x", "<p>x</p>");
        CorpusFixtures.writePage(corpusDir, "a/z.json", "https://a/z", "<p>z</p>");
        CorpusFixtures.writePage(corpusDir, "a/b/y.json", "https://a/b/y", "<p>y</p>");
        CorpusFixtures.writePage(corpusDir, "root.json", "https://root", "<p>r</p>");
        Files.writeString(corpusDir.resolve("notes.txt"), "not a page");

        List<Document> documents = new ArrayList<>();
        CorpusScanner.ScanSummary summary = new CorpusScanner(corpusDir).scan((document, page) -> documents.add(document));

        assertEquals(4, summary.documentCount());
        assertEquals(0, summary.skippedCount());
        assertEquals(List.of("a/b/y.json", "a/z.json", "b/x.json", "root.json"),
            documents.stream().map(Document::source).toList());
        for (int index = 0; index < documents.size(); index++) {
            assertEquals(index, documents.get(index).docId());
        }
        assertEquals(CorpusScanner.fingerprint(documents.stream().map(Document::source).toList()), summary.fingerprint());
    }

    @Test
    void testMalformedPagesAreSkippedWithoutConsumingDocIds() throws IOException {
        CorpusFixtures.writePage(corpusDir, "1.json", "https://one", "<p>one</p>");
        Files.writeString(corpusDir.resolve("2.json"), "{ not json");
        Files.writeString(corpusDir.resolve("3.json"), "{\"content\": \"<p>no url</p>\"}");
        Files.writeString(corpusDir.resolve("4.json"), "{\"url\": \"https://no-content\"}");
        CorpusFixtures.writePage(corpusDir, "5.json", "https://five", "<p>five</p>");

        List<Document> documents = new ArrayList<>();
        CorpusScanner.ScanSummary summary = new CorpusScanner(corpusDir).scan((document, page) -> documents.add(document));

        assertEquals(2, summary.documentCount());
        assertEquals(3, summary.skippedCount());
        assertEquals(new Document(0, "https://one", "1.json"), documents.get(0));
        assertEquals(new Document(1, "https://five", "5.json"), documents.get(1));
    }

    @Test
    void testUnknownFieldsAreIgnored() throws IOException {
        Files.writeString(corpusDir.resolve("page.json"),
            "{\"url\": \"https://x\", \"content\": \"<p>x</p>\", \"encoding\": \"ascii\", \"crawledAt\": 1}");

        List<CrawledPage> pages = new ArrayList<>();
        new CorpusScanner(corpusDir).scan((document, page) -> pages.add(page));

        assertEquals(1, pages.size());
        assertEquals("ascii", pages.get(0).encoding());
    }

    @Test
    void testRepeatedScanIsDeterministic() throws IOException {
        CorpusFixtures.writeNumberedCorpus(corpusDir, 12);

        CorpusScanner scanner = new CorpusScanner(corpusDir);
        List<Document> first = new ArrayList<>();
        List<Document> second = new ArrayList<>();
        long firstFingerprint = scanner.scan((document, page) -> first.add(document)).fingerprint();
        long secondFingerprint = scanner.scan((document, page) -> second.add(document)).fingerprint();

        assertEquals(first, second);
        assertEquals(firstFingerprint, secondFingerprint);
    }

    @Test
    void testMissingCorpusDirectory() {
        CorpusScanner scanner = new CorpusScanner(corpusDir.resolve("absent"));
        assertThrows(IOException.class, () -> scanner.scan((document, page) -> { }));
    }
}
