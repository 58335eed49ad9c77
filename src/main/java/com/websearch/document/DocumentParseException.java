package com.websearch.document;

/**
 * 单个文档无法解析或抽取时抛出。调用方记录告警后跳过该文档，不中断索引构建。
 */
public class DocumentParseException extends Exception {
    private final String source;

    public DocumentParseException(String source, String message) {
        super(message + ": " + source);
        this.source = source;
    }

    public DocumentParseException(String source, String message, Throwable cause) {
        super(message + ": " + source, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
