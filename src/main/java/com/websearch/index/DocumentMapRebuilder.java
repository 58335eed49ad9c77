package com.websearch.index;

import com.websearch.config.ConfigException;
import com.websearch.document.CorpusScanner;
import com.websearch.document.Document;
import com.websearch.document.DocumentMap;
import com.websearch.storage.IndexMeta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * 从语料重新生成 docId → URL 映射。
 *
 * <p>重新扫描得到的文档数与来源指纹必须与已提交索引一致，否则拒绝写入，避免 docId 错位。
 */
public final class DocumentMapRebuilder {
    private static final Logger logger = LoggerFactory.getLogger(DocumentMapRebuilder.class);

    private DocumentMapRebuilder() {
    }

    /**
     * 重建并持久化文档映射。
     *
     * @param layout 索引目录布局
     * @param meta 已提交索引的元数据
     * @param corpusDir 构建该索引时使用的语料目录
     * @return 重建后的映射
     * @throws ConfigException 语料目录不存在时抛出
     * @throws IOException 扫描失败或语料与索引不一致时抛出
     */
    public static DocumentMap rebuild(IndexLayout layout, IndexMeta meta, Path corpusDir) throws IOException {
        if (corpusDir == null || !Files.isDirectory(corpusDir)) {
            throw new ConfigException("语料目录不存在: " + corpusDir);
        }
        List<Document> documents = new ArrayList<>();
        CorpusScanner.ScanSummary summary = new CorpusScanner(corpusDir).scan((document, page) -> documents.add(document));
        if (summary.documentCount() != meta.docCount()) {
            throw new IOException("语料文档数与索引不一致，无法重建文档映射: index=" + meta.docCount()
                + ", corpus=" + summary.documentCount());
        }
        if (summary.fingerprint() != meta.corpusFingerprint()) {
            throw new IOException("语料来源指纹与索引不一致，无法重建文档映射: index=" + meta.corpusFingerprint()
                + ", corpus=" + summary.fingerprint());
        }

        DocumentMap documentMap = DocumentMap.of(documents);
        Files.deleteIfExists(layout.stagedDocumentsDb());
        documentMap.writeTo(layout.stagedDocumentsDb());
        Files.move(layout.stagedDocumentsDb(), layout.documentsDb(),
            StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        logger.info("文档映射已重建: docs={}, corpus={}", documentMap.size(), corpusDir);
        return documentMap;
    }
}
