package com.websearch.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.websearch.query.QueryMode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 引擎运行时配置
 * 
 * 支持从CLI参数或JSON配置文件注入，覆盖Constants默认值
 */
public class EngineConfig {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private Path indexDir = Paths.get("./index");
    private int indexThreads = Constants.DEFAULT_INDEX_THREADS;
    private int segmentMaxDocs = Constants.SEGMENT_MAX_DOCS;
    private int segmentMaxTerms = Constants.SEGMENT_MAX_TERMS;
    private long segmentMaxBytes = Constants.SEGMENT_MAX_BYTES;
    private boolean retainSegments;
    private boolean stopWordsEnabled = true;
    private FieldWeights fieldWeights = FieldWeights.defaults();
    private int defaultTopK = Constants.DEFAULT_TOP_K;
    private QueryMode defaultMode = QueryMode.AND;
    
    @JsonIgnore
    public Path getIndexDir() {
        return indexDir;
    }
    
    @JsonIgnore
    public void setIndexDir(Path indexDir) {
        this.indexDir = indexDir;
    }
    
    public int getIndexThreads() {
        return indexThreads;
    }
    
    public void setIndexThreads(int indexThreads) {
        this.indexThreads = indexThreads;
    }
    
    public int getSegmentMaxDocs() {
        return segmentMaxDocs;
    }
    
    public void setSegmentMaxDocs(int segmentMaxDocs) {
        this.segmentMaxDocs = segmentMaxDocs;
    }
    
    public int getSegmentMaxTerms() {
        return segmentMaxTerms;
    }
    
    public void setSegmentMaxTerms(int segmentMaxTerms) {
        this.segmentMaxTerms = segmentMaxTerms;
    }
    
    public long getSegmentMaxBytes() {
        return segmentMaxBytes;
    }
    
    public void setSegmentMaxBytes(long segmentMaxBytes) {
        this.segmentMaxBytes = segmentMaxBytes;
    }
    
    public boolean isRetainSegments() {
        return retainSegments;
    }
    
    public void setRetainSegments(boolean retainSegments) {
        this.retainSegments = retainSegments;
    }
    
    public boolean isStopWordsEnabled() {
        return stopWordsEnabled;
    }
    
    public void setStopWordsEnabled(boolean stopWordsEnabled) {
        this.stopWordsEnabled = stopWordsEnabled;
    }
    
    public FieldWeights getFieldWeights() {
        return fieldWeights;
    }
    
    public void setFieldWeights(FieldWeights fieldWeights) {
        this.fieldWeights = fieldWeights;
    }
    
    public int getDefaultTopK() {
        return defaultTopK;
    }
    
    public void setDefaultTopK(int defaultTopK) {
        this.defaultTopK = defaultTopK;
    }
    
    public QueryMode getDefaultMode() {
        return defaultMode;
    }
    
    public void setDefaultMode(QueryMode defaultMode) {
        this.defaultMode = defaultMode;
    }
    
    /**
     * 校验配置取值，非法时抛出 ConfigException。
     *
     * @return 当前实例，便于链式调用
     */
    public EngineConfig validate() {
        if (indexDir == null) {
            throw new ConfigException("索引目录不能为空");
        }
        if (indexThreads <= 0 || indexThreads > Constants.MAX_INDEX_THREADS) {
            throw new ConfigException("索引线程数非法: " + indexThreads + "（范围 1-" + Constants.MAX_INDEX_THREADS + "）");
        }
        if (segmentMaxDocs < 0 || segmentMaxTerms < 0 || segmentMaxBytes < 0) {
            throw new ConfigException("段刷写阈值不能为负数: maxDocs=" + segmentMaxDocs
                + ", maxTerms=" + segmentMaxTerms + ", maxBytes=" + segmentMaxBytes);
        }
        if (fieldWeights == null) {
            throw new ConfigException("字段权重不能为空");
        }
        if (defaultTopK <= 0) {
            throw new ConfigException("topK 必须为正数: " + defaultTopK);
        }
        if (defaultMode == null) {
            throw new ConfigException("查询模式不能为空");
        }
        return this;
    }
    
    /**
     * 使用默认配置创建实例
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }
    
    /**
     * 从 JSON 配置文件加载，未出现的字段保留默认值，未知字段视为配置错误。
     *
     * @param configFile JSON 配置文件
     * @return 已校验的配置
     * @throws IOException 文件读取失败时抛出
     */
    public static EngineConfig load(Path configFile) throws IOException {
        if (configFile == null) {
            throw new IllegalArgumentException("配置文件不能为空");
        }
        if (!Files.isRegularFile(configFile)) {
            throw new ConfigException("配置文件不存在: " + configFile.toAbsolutePath());
        }
        EngineConfig config;
        try {
            config = OBJECT_MAPPER.readValue(configFile.toFile(), EngineConfig.class);
        } catch (JsonProcessingException exception) {
            throw new ConfigException("配置文件格式错误: " + configFile + " - " + exception.getOriginalMessage(), exception);
        }
        return config.validate();
    }
}
