package com.websearch.config;

import java.util.List;

/**
 * 全局常量定义
 * 
 * 包含存储格式魔数、段刷写阈值、字段权重默认值、查询参数与批量查询集合
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }
    
    // ==================== 存储格式魔数 ====================
    /** 部分段文件魔数 "WSSG" */
    public static final int SEGMENT_MAGIC = 0x57535347;
    /** 最终索引文件魔数 "WSIX" */
    public static final int INDEX_MAGIC = 0x57534958;
    /** 文件格式版本号 */
    public static final short FORMAT_VERSION = 1;
    
    // ==================== 索引参数 ====================
    /** 单个部分段缓冲的文档上限，0 表示不按文档数刷写 */
    public static final int SEGMENT_MAX_DOCS = 10_000;
    /** 单个部分段缓冲的不同词项上限 */
    public static final int SEGMENT_MAX_TERMS = 50_000;
    /** 单个部分段估算内存上限（64MB） */
    public static final long SEGMENT_MAX_BYTES = 64L * 1024 * 1024;
    
    // ==================== 字段权重 ====================
    /** title 中的词项权重（正文 1 + 加权 5） */
    public static final int TITLE_WEIGHT = 6;
    /** h1-h3 中的词项权重 */
    public static final int HEADING_WEIGHT = 5;
    /** b/strong 中的词项权重 */
    public static final int BOLD_WEIGHT = 4;
    /** 普通正文词项权重 */
    public static final int BODY_WEIGHT = 1;
    
    // ==================== 查询参数 ====================
    /** 默认返回结果数量 */
    public static final int DEFAULT_TOP_K = 5;
    /** 查询字符串最大长度 */
    public static final int MAX_QUERY_LENGTH = 1024;
    /** 批量模式执行的固定查询集合 */
    public static final List<String> CANONICAL_QUERIES = List.of(
        "cristina lopes",
        "machine learning",
        "ACM",
        "master of software engineering"
    );
    
    // ==================== 线程参数 ====================
    /** 默认索引工作线程数 */
    public static final int DEFAULT_INDEX_THREADS = Math.max(1, Runtime.getRuntime().availableProcessors());
    /** 索引线程数安全上限 */
    public static final int MAX_INDEX_THREADS = 64;
    /** 文档投递队列容量 */
    public static final int INGEST_QUEUE_CAPACITY = 256;
}
