package com.websearch.text;

/**
 * 切分出的原词。
 *
 * @param term 小写原词，尚未去停用词与词干化
 * @param position 在所属文本片段中的序号，从 0 开始
 */
public record Token(String term, int position) {
}
