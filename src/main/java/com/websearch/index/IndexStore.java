package com.websearch.index;

import com.websearch.document.Document;
import com.websearch.document.DocumentMap;
import com.websearch.storage.IndexFileReader;
import com.websearch.storage.IndexMeta;
import com.websearch.storage.PostingList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 只读的已提交索引：最终倒排索引、文档映射与元数据。
 *
 * <p>打开后不可变，可在多个查询线程间共享。
 */
public final class IndexStore implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(IndexStore.class);

    private final IndexLayout layout;
    private final IndexMeta meta;
    private final IndexFileReader indexReader;
    private final DocumentMap documentMap;

    private IndexStore(IndexLayout layout, IndexMeta meta, IndexFileReader indexReader, DocumentMap documentMap) {
        this.layout = layout;
        this.meta = meta;
        this.indexReader = indexReader;
        this.documentMap = documentMap;
    }

    /**
     * 打开已提交的索引。
     *
     * @param indexDir 索引目录
     * @return 索引
     * @throws IndexMissingException 目录中没有已提交索引时抛出
     * @throws IOException 文件损坏或各部分不一致时抛出
     */
    public static IndexStore open(Path indexDir) throws IOException {
        return open(indexDir, null);
    }

    /**
     * 打开已提交的索引；文档映射缺失且给出语料目录时从语料重建。
     *
     * @param indexDir 索引目录
     * @param corpusDir 语料目录，可为 null
     * @return 索引
     * @throws IndexMissingException 目录中没有已提交索引时抛出
     * @throws IOException 文件损坏、各部分不一致或文档映射无法恢复时抛出
     */
    public static IndexStore open(Path indexDir, Path corpusDir) throws IOException {
        IndexLayout layout = new IndexLayout(indexDir);
        if (!Files.isRegularFile(layout.metaFile())) {
            throw new IndexMissingException(layout.indexDir());
        }
        IndexMeta meta = IndexMeta.readFrom(layout.metaFile());
        DocumentMap documentMap = loadDocumentMap(layout, meta, corpusDir);

        IndexFileReader indexReader = IndexFileReader.open(layout.finalIndex());
        try {
            verifyConsistency(meta, indexReader, documentMap);
        } catch (IOException exception) {
            indexReader.close();
            throw exception;
        }
        logger.debug("索引已打开: dir={}, docs={}, terms={}", layout.indexDir(), meta.docCount(), meta.termCount());
        return new IndexStore(layout, meta, indexReader, documentMap);
    }

    /**
     * 读取已提交索引的元数据。
     *
     * @throws IndexMissingException 目录中没有已提交索引时抛出
     */
    public static IndexMeta readMeta(Path indexDir) throws IOException {
        IndexLayout layout = new IndexLayout(indexDir);
        if (!Files.isRegularFile(layout.metaFile())) {
            throw new IndexMissingException(layout.indexDir());
        }
        return IndexMeta.readFrom(layout.metaFile());
    }

    private static DocumentMap loadDocumentMap(IndexLayout layout, IndexMeta meta, Path corpusDir) throws IOException {
        if (Files.isRegularFile(layout.documentsDb())) {
            return DocumentMap.load(layout.documentsDb());
        }
        if (corpusDir == null) {
            throw new IOException("文档映射缺失: " + layout.documentsDb() + "（可通过 rebuild-docmap 从语料重建）");
        }
        logger.warn("文档映射缺失，从语料重建: {}", corpusDir);
        return DocumentMapRebuilder.rebuild(layout, meta, corpusDir);
    }

    private static void verifyConsistency(IndexMeta meta, IndexFileReader indexReader, DocumentMap documentMap)
        throws IOException {
        if (indexReader.getDocCount() != meta.docCount() || documentMap.size() != meta.docCount()) {
            throw new IOException("索引文档数不一致: meta=" + meta.docCount()
                + ", index=" + indexReader.getDocCount() + ", docMap=" + documentMap.size());
        }
        if (indexReader.getTermCount() != meta.termCount() || indexReader.getPostingCount() != meta.postingCount()) {
            throw new IOException("索引词项统计不一致: meta=" + meta.termCount() + "/" + meta.postingCount()
                + ", index=" + indexReader.getTermCount() + "/" + indexReader.getPostingCount());
        }
        if (documentMap.fingerprint() != meta.corpusFingerprint()) {
            throw new IOException("文档映射来源指纹与索引不一致: meta=" + meta.corpusFingerprint()
                + ", docMap=" + documentMap.fingerprint());
        }
    }

    /**
     * 查询词项的倒排列表，未出现的词项返回空列表。
     */
    public PostingList lookup(String term) throws IOException {
        return indexReader.postings(term);
    }

    /**
     * 词项的文档频次，未出现的词项返回 0。
     */
    public int docFrequency(String term) {
        return indexReader.docFrequency(term);
    }

    public int totalDocuments() {
        return meta.docCount();
    }

    /**
     * @throws com.websearch.document.UnknownDocIdException docId 不在映射中时抛出
     */
    public Document resolve(int docId) {
        return documentMap.resolve(docId);
    }

    public IndexMeta meta() {
        return meta;
    }

    public DocumentMap documentMap() {
        return documentMap;
    }

    public IndexStatus status() throws IOException {
        long sizeBytes = Files.size(layout.finalIndex()) + Files.size(layout.documentsDb()) + Files.size(layout.metaFile());
        return new IndexStatus(layout.indexDir(), meta.docCount(), meta.termCount(), meta.postingCount(),
            meta.segmentCount(), meta.skippedDocuments(), sizeBytes, meta.createdAt());
    }

    @Override
    public void close() throws IOException {
        indexReader.close();
    }
}
