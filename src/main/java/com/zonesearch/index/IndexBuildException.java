package com.zonesearch.index;

import com.zonesearch.ErrorKind;

/**
 * 语料文档校验失败，构建随即中止。
 */
public class IndexBuildException extends RuntimeException {
    private final ErrorKind kind;
    private final int documentOrdinal;

    public IndexBuildException(ErrorKind kind, int documentOrdinal, String message) {
        super(kind.displayName() + ": 第 " + documentOrdinal + " 篇文档 - " + message);
        this.kind = kind;
        this.documentOrdinal = documentOrdinal;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * 出错文档在语料中的序号，从 0 开始。
     */
    public int getDocumentOrdinal() {
        return documentOrdinal;
    }
}
