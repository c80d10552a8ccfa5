package com.zonesearch.config;

/**
 * 全局常量定义
 * 
 * 包含索引文件布局、语料格式、查询参数与格式版本
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 索引文件布局 ====================
    /** build 在输出父目录下创建的索引目录名 */
    public static final String INDEX_FOLDER_NAME = "index";
    /** 倒排索引文件名 */
    public static final String INDEX_FILE_NAME = "index.tsv";
    /** 文档索引文件名 */
    public static final String DOC_INDEX_FILE_NAME = "docIndex.tsv";
    /** 索引元数据文件名 */
    public static final String META_FILE_NAME = "meta.json";
    /** 文件格式版本号 */
    public static final int FORMAT_VERSION = 1;

    // ==================== TSV 分隔符 ====================
    /** 列分隔符 */
    public static final char COLUMN_SEPARATOR = '\t';
    /** 倒排项之间的分隔符 */
    public static final char POSTING_SEPARATOR = ';';
    /** docID 与位置列表之间的分隔符 */
    public static final char DOC_POSITIONS_SEPARATOR = ':';
    /** 位置之间的分隔符 */
    public static final char POSITION_SEPARATOR = ',';
    /** 文档索引中词项之间的分隔符 */
    public static final char TOKEN_SEPARATOR = ' ';

    // ==================== 语料格式 ====================
    /** 语料中 docID 区域的字段名 */
    public static final String DOC_ID_ZONE = "doc_id";
    /** 一个合法文档的最少区域数（docID 区域 + 至少一个内容区域） */
    public static final int MIN_ZONES = 2;

    // ==================== 查询参数 ====================
    /** 默认短语起始分隔符 */
    public static final char DEFAULT_PHRASE_START = ':';
    /** 默认短语结束分隔符 */
    public static final char DEFAULT_PHRASE_END = ':';
    /** 默认返回结果数 */
    public static final int DEFAULT_RESULT_LIMIT = 10;
}
