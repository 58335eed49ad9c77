package com.websearch.document;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 不可变的 docId 与 URL 双向映射，构建完成后可被并发查询共享。
 *
 * <p>抓取语料中同一 URL 可能出现多次，URL 反查返回其中最小的 docId。
 */
public final class DocumentMap {
    private final List<Document> documents;
    private final Map<String, Integer> docIdByUrl;

    private DocumentMap(List<Document> documents) {
        this.documents = Collections.unmodifiableList(documents);
        Map<String, Integer> byUrl = new HashMap<>();
        for (Document document : documents) {
            byUrl.putIfAbsent(document.url(), document.docId());
        }
        this.docIdByUrl = Collections.unmodifiableMap(byUrl);
    }

    /**
     * 由按 docId 连续排列（0..n-1）的文档列表创建映射。
     *
     * @param orderedDocuments 文档列表
     * @return 映射
     */
    public static DocumentMap of(List<Document> orderedDocuments) {
        if (orderedDocuments == null) {
            throw new IllegalArgumentException("文档列表不能为空");
        }
        List<Document> copy = new ArrayList<>(orderedDocuments.size());
        for (int index = 0; index < orderedDocuments.size(); index++) {
            Document document = orderedDocuments.get(index);
            if (document.docId() != index) {
                throw new IllegalArgumentException("docId必须从0连续递增，位置=" + index + ", docId=" + document.docId());
            }
            copy.add(document);
        }
        return new DocumentMap(copy);
    }

    /**
     * 从 SQLite 文档表加载映射。
     *
     * @param dbPath 文档表文件
     * @return 映射
     * @throws IOException 文件不存在或 docId 不连续时抛出
     */
    public static DocumentMap load(Path dbPath) throws IOException {
        if (!Files.isRegularFile(dbPath)) {
            throw new IOException("文档映射文件不存在: " + dbPath);
        }
        try (DocumentTable documentTable = new DocumentTable(dbPath)) {
            return of(documentTable.findAll());
        } catch (IllegalArgumentException exception) {
            throw new IOException("文档映射已损坏: " + dbPath + " - " + exception.getMessage(), exception);
        }
    }

    /**
     * 将映射完整写入指定的 SQLite 文件（覆盖已有内容）。
     */
    public void writeTo(Path dbPath) {
        try (DocumentTable documentTable = new DocumentTable(dbPath)) {
            documentTable.replaceAll(documents);
        }
    }

    /**
     * 解析 docId 对应的文档。
     *
     * @throws UnknownDocIdException docId 不存在时抛出
     */
    public Document resolve(int docId) {
        if (docId < 0 || docId >= documents.size()) {
            throw new UnknownDocIdException(docId);
        }
        return documents.get(docId);
    }

    public Optional<Document> find(int docId) {
        if (docId < 0 || docId >= documents.size()) {
            return Optional.empty();
        }
        return Optional.of(documents.get(docId));
    }

    public Optional<Integer> docIdOf(String url) {
        return Optional.ofNullable(docIdByUrl.get(url));
    }

    public int size() {
        return documents.size();
    }

    public List<Document> documents() {
        return documents;
    }

    /**
     * 有序来源列表指纹，与 CorpusScanner 扫描结果可比。
     */
    public long fingerprint() {
        List<String> sources = new ArrayList<>(documents.size());
        for (Document document : documents) {
            sources.add(document.source());
        }
        return CorpusScanner.fingerprint(sources);
    }
}
