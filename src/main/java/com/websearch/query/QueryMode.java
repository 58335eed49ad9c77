package com.websearch.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.websearch.config.ConfigException;

import java.util.Locale;

/**
 * 多词查询的组合方式。
 */
public enum QueryMode {
    /** 文档必须包含全部查询词 */
    AND,
    /** 文档包含任一查询词即可 */
    OR;

    /**
     * 不区分大小写解析模式名。
     *
     * @throws ConfigException 模式名未知时抛出
     */
    @JsonCreator
    public static QueryMode parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigException("查询模式不能为空");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException exception) {
            throw new ConfigException("未知查询模式: " + value + "（可选 AND、OR）", exception);
        }
    }
}
