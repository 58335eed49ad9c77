package com.websearch.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * 查询结果 JSON 输出：{查询文本: {query, mode, hits, totalMatches, elapsedMs}}。
 */
public final class QueryResultWriter {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private QueryResultWriter() {
    }

    public static String toJson(Map<String, SearchResult> results) throws IOException {
        return OBJECT_MAPPER.writeValueAsString(results);
    }

    public static String toJson(SearchResult result) throws IOException {
        return OBJECT_MAPPER.writeValueAsString(result);
    }

    /**
     * 写出结果文件，父目录不存在时自动创建。
     *
     * @param results 查询结果
     * @param outputFile 输出文件
     * @throws IOException 写入失败时抛出
     */
    public static void write(Map<String, SearchResult> results, Path outputFile) throws IOException {
        if (outputFile == null) {
            throw new IllegalArgumentException("输出文件不能为空");
        }
        Path parent = outputFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try {
            OBJECT_MAPPER.writeValue(outputFile.toFile(), results);
        } catch (IOException exception) {
            throw new IOException("写入查询结果失败: " + outputFile.toAbsolutePath(), exception);
        }
    }
}
