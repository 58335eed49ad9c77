package com.websearch.storage;

/**
 * 词典词条，记录词项的文档频次与倒排块在最终索引文件中的位置。
 */
public record TermEntry(String term, int docFreq, long blockOffset, int blockLength) {
}
