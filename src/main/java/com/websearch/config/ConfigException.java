package com.websearch.config;

/**
 * 配置非法时抛出，例如 topK 非正数、未知查询模式或阈值为负数。
 */
public class ConfigException extends IllegalArgumentException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
