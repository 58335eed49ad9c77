package com.websearch.index;

/**
 * 一次完整构建的结果。
 *
 * @param docCount 分配了 docId 的文档数
 * @param skippedDocuments 因 JSON 格式错误被跳过的源文件数
 * @param unparsedContent 正文无法解析、按空文档收录的页面数
 * @param segmentCount 写出的部分段数
 * @param termCount 最终索引词项数
 * @param postingCount 最终索引倒排项数
 * @param elapsedMs 构建耗时
 */
public record BuildReport(
    int docCount,
    int skippedDocuments,
    int unparsedContent,
    int segmentCount,
    int termCount,
    long postingCount,
    long elapsedMs
) {
}
