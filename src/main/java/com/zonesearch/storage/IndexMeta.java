package com.zonesearch.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.zonesearch.config.Constants;
import com.zonesearch.index.IndexStatus;

import java.io.File;
import java.io.IOException;
import java.time.Instant;

/**
 * 索引元数据，描述索引的格式版本、基础统计与创建时间。
 */
public record IndexMeta(
    int formatVersion,
    int docCount,
    int termCount,
    long tokenCount,
    Instant createTime
) {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public static IndexMeta of(IndexStatus status, Instant createTime) {
        return new IndexMeta(Constants.FORMAT_VERSION, status.docCount(), status.termCount(),
            status.tokenCount(), createTime);
    }

    /**
     * 将元数据写入指定 JSON 文件。
     *
     * @param file 元数据文件
     * @throws IOException 写入失败时抛出
     */
    public void writeTo(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("元数据文件不能为空");
        }
        try {
            OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(file, this);
        } catch (IOException exception) {
            throw new IOException("写入索引元数据失败: " + file.getAbsolutePath(), exception);
        }
    }

    /**
     * 从指定 JSON 文件读取元数据。
     *
     * @param file 元数据文件
     * @return 反序列化后的元数据
     * @throws IOException 读取或解析失败时抛出
     */
    public static IndexMeta readFrom(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("元数据文件不能为空");
        }
        try {
            return OBJECT_MAPPER.readValue(file, IndexMeta.class);
        } catch (IOException exception) {
            throw new IOException("读取索引元数据失败: " + file.getAbsolutePath(), exception);
        }
    }
}
