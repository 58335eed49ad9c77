package com.websearch.storage;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.websearch.config.FieldWeights;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * 索引提交元数据，写入 index.json。该文件存在即表示一次构建已完整提交。
 *
 * @param formatVersion 存储格式版本
 * @param docCount 文档总数 N
 * @param termCount 最终索引词项数
 * @param postingCount 最终索引倒排项总数
 * @param segmentCount 构建过程中产生的部分段数量
 * @param skippedDocuments 解析失败被跳过的源文件数
 * @param stopWordsEnabled 构建时是否过滤停用词
 * @param fieldWeights 构建时使用的字段权重
 * @param corpusFingerprint 有序源文件列表的 CRC32 指纹
 * @param createdAt 提交时间
 */
public record IndexMeta(
    int formatVersion,
    int docCount,
    int termCount,
    long postingCount,
    int segmentCount,
    int skippedDocuments,
    boolean stopWordsEnabled,
    FieldWeights fieldWeights,
    long corpusFingerprint,
    Instant createdAt
) {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public IndexMeta {
        if (docCount < 0 || termCount < 0 || postingCount < 0 || segmentCount < 0 || skippedDocuments < 0) {
            throw new IllegalArgumentException("索引元数据计数不能为负数");
        }
        if (fieldWeights == null) {
            throw new IllegalArgumentException("fieldWeights 不能为空");
        }
    }

    /**
     * 先写临时文件再原子替换，保证 index.json 要么完整要么不存在。
     *
     * @param file 元数据文件
     * @throws IOException 写入失败时抛出
     */
    public void writeTo(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("元数据文件不能为空");
        }
        Path tempFile = StorageFileUtil.tempPathFor(file);
        try {
            OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(tempFile.toFile(), this);
            StorageFileUtil.commitAtomically(tempFile, file);
        } catch (IOException exception) {
            Files.deleteIfExists(tempFile);
            throw new IOException("写入索引元数据失败: " + file.toAbsolutePath(), exception);
        }
    }

    /**
     * 从 JSON 文件读取索引元数据。
     *
     * @param file 元数据文件
     * @return 元数据
     * @throws IOException 读取或解析失败时抛出
     */
    public static IndexMeta readFrom(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("元数据文件不能为空");
        }
        try {
            return OBJECT_MAPPER.readValue(file.toFile(), IndexMeta.class);
        } catch (IOException exception) {
            throw new IOException("读取索引元数据失败: " + file.toAbsolutePath(), exception);
        }
    }
}
