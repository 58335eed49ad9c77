package com.websearch.text;

import java.util.List;

/**
 * 将单个字段片段的文本切分为原词序列。
 */
public interface Tokenizer {

    /**
     * @param text 文本，可为 null
     * @return 按出现顺序排列的原词，文本为空时返回空列表
     */
    List<Token> tokenize(String text);
}
