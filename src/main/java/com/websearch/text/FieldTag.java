package com.websearch.text;

import java.util.Locale;

/**
 * 文本所在的 HTML 结构字段，声明顺序即优先级（越靠前越重要）。
 */
public enum FieldTag {
    TITLE,
    HEADING,
    BOLD,
    BODY;

    /**
     * 根据元素名推断字段，未识别的元素归为 BODY。
     *
     * @param elementName HTML 元素名
     * @return 对应字段
     */
    public static FieldTag fromElementName(String elementName) {
        if (elementName == null) {
            return BODY;
        }
        return switch (elementName.toLowerCase(Locale.ROOT)) {
            case "title" -> TITLE;
            case "h1", "h2", "h3" -> HEADING;
            case "b", "strong" -> BOLD;
            default -> BODY;
        };
    }

    /**
     * 返回两个字段中优先级更高的一个。
     */
    public static FieldTag strongest(FieldTag left, FieldTag right) {
        return left.ordinal() <= right.ordinal() ? left : right;
    }
}
