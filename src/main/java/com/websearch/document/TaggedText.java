package com.websearch.document;

import com.websearch.text.FieldTag;

/**
 * 带字段标签的可见文本片段。
 */
public record TaggedText(String text, FieldTag tag) {
}
