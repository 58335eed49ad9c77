package com.websearch.document;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import java.util.zip.CRC32;

/**
 * 语料目录扫描器。
 *
 * <p>遍历顺序为语料目录下 *.json 文件的相对路径字典序（统一 / 分隔），与平台的目录列举顺序无关。
 * docId 仅分配给成功解析的页面，因此以相同语料重复扫描会得到完全相同的 docId 分配。
 */
public class CorpusScanner {
    private static final Logger logger = LoggerFactory.getLogger(CorpusScanner.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final String PAGE_SUFFIX = ".json";

    private final Path corpusDir;

    /**
     * 创建扫描器。
     *
     * @param corpusDir 语料根目录
     */
    public CorpusScanner(Path corpusDir) {
        if (corpusDir == null) {
            throw new IllegalArgumentException("语料目录不能为空");
        }
        this.corpusDir = corpusDir.toAbsolutePath().normalize();
    }

    /**
     * 按确定顺序扫描语料，逐个回调成功解析的页面。
     *
     * @param visitor 页面回调
     * @return 扫描统计
     * @throws IOException 语料目录不可读或回调失败时抛出
     */
    public ScanSummary scan(PageVisitor visitor) throws IOException {
        if (!Files.isDirectory(corpusDir)) {
            throw new IOException("语料目录不存在: " + corpusDir);
        }
        int nextDocId = 0;
        int skipped = 0;
        CRC32 fingerprint = new CRC32();
        for (Path file : listSources()) {
            String source = relativeSource(file);
            CrawledPage page;
            try {
                page = readPage(file, source);
            } catch (DocumentParseException exception) {
                skipped++;
                logger.warn("跳过无法解析的页面: {}", exception.getMessage());
                continue;
            }
            Document document = new Document(nextDocId++, page.url(), source);
            updateFingerprint(fingerprint, source);
            visitor.visit(document, page);
        }
        return new ScanSummary(nextDocId, skipped, fingerprint.getValue());
    }

    /**
     * 列出全部候选页面文件，按相对路径排序。
     */
    public List<Path> listSources() throws IOException {
        List<Path> files = new ArrayList<>();
        try (Stream<Path> stream = Files.walk(corpusDir)) {
            stream.filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().endsWith(PAGE_SUFFIX))
                .forEach(files::add);
        }
        files.sort(Comparator.comparing(this::relativeSource));
        return files;
    }

    /**
     * 计算有序来源列表的指纹，用于校验文档映射重建是否复现了原始遍历顺序。
     */
    public static long fingerprint(List<String> orderedSources) {
        CRC32 crc32 = new CRC32();
        for (String source : orderedSources) {
            updateFingerprint(crc32, source);
        }
        return crc32.getValue();
    }

    public Path getCorpusDir() {
        return corpusDir;
    }

    private static void updateFingerprint(CRC32 crc32, String source) {
        crc32.update(source.getBytes(StandardCharsets.UTF_8));
        crc32.update('\n');
    }

    private CrawledPage readPage(Path file, String source) throws DocumentParseException {
        CrawledPage page;
        try (InputStream inputStream = Files.newInputStream(file)) {
            page = OBJECT_MAPPER.readValue(inputStream, CrawledPage.class);
        } catch (IOException exception) {
            throw new DocumentParseException(source, "页面 JSON 解析失败", exception);
        }
        if (page == null || page.url() == null || page.url().isBlank()) {
            throw new DocumentParseException(source, "页面缺少 url");
        }
        if (page.content() == null) {
            throw new DocumentParseException(source, "页面缺少 content");
        }
        return page;
    }

    private String relativeSource(Path file) {
        return corpusDir.relativize(file.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }

    /**
     * 页面回调。
     */
    @FunctionalInterface
    public interface PageVisitor {
        void visit(Document document, CrawledPage page) throws IOException;
    }

    /**
     * 扫描统计。
     *
     * @param documentCount 分配了 docId 的页面数
     * @param skippedCount 因格式错误跳过的页面数
     * @param fingerprint 有序来源列表指纹
     */
    public record ScanSummary(int documentCount, int skippedCount, long fingerprint) {
    }
}
