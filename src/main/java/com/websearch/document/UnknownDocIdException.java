package com.websearch.document;

/**
 * docId 在文档映射中不存在。倒排表只会引用已分配的 docId，出现该异常说明索引与文档映射不一致。
 */
public class UnknownDocIdException extends IllegalStateException {
    private final int docId;

    public UnknownDocIdException(int docId) {
        super("文档映射中不存在 docId=" + docId + "，索引与文档映射不一致");
        this.docId = docId;
    }

    public int getDocId() {
        return docId;
    }
}
