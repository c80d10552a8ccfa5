package com.zonesearch;

/**
 * 构建与查询阶段可报告的错误类别，均为不可恢复错误。
 */
public enum ErrorKind {
    /** docID 重复、缺失或不是非负整数 */
    DUPLICATE_OR_MISSING_DOC_ID("DuplicateOrMissingDocID"),
    /** 区域数少于 2（docID 区域 + 至少一个内容区域） */
    INSUFFICIENT_ZONES("InsufficientZones"),
    /** 区域内容为空 */
    EMPTY_ZONE_CONTENT("EmptyZoneContent"),
    /** 索引目录中缺少 index.tsv 或 docIndex.tsv */
    INDEX_FILES_NOT_FOUND("IndexFilesNotFound"),
    /** 短语分隔符位置非法或不成对 */
    MALFORMED_PHRASE_DELIMITER("MalformedPhraseDelimiter"),
    /** 命令行参数个数不正确 */
    INVALID_ARGUMENT_COUNT("InvalidArgumentCount");

    private final String displayName;

    ErrorKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
