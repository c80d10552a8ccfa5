package com.zonesearch.document;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * 语料读取器：语料文件为 JSON 对象数组，每个对象的字段即文档区域。
 * 采用流式解析，一次只把一篇文档交给调用方。
 */
public final class CorpusReader {
    private static final Logger logger = LoggerFactory.getLogger(CorpusReader.class);

    private final ObjectMapper objectMapper;

    public CorpusReader() {
        this(new ObjectMapper());
    }

    public CorpusReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 逐篇读取语料并交给 consumer，返回读取的文档数。consumer 抛出的异常会直接中止读取。
     *
     * @param corpusPath 语料文件
     * @param consumer 文档消费者
     * @return 读取的文档数
     * @throws IOException 文件不存在或 JSON 格式错误时抛出
     */
    public int read(Path corpusPath, Consumer<Document> consumer) throws IOException {
        if (corpusPath == null) {
            throw new IllegalArgumentException("语料路径不能为空");
        }
        if (!Files.isRegularFile(corpusPath)) {
            throw new NoSuchFileException(corpusPath.toString(), null, "找不到语料文件");
        }

        try (InputStream inputStream = Files.newInputStream(corpusPath)) {
            int count = read(inputStream, consumer);
            logger.info("语料读取完成: {}，共 {} 篇文档", corpusPath, count);
            return count;
        }
    }

    /**
     * 从输入流逐篇读取语料。
     */
    public int read(InputStream inputStream, Consumer<Document> consumer) throws IOException {
        try (JsonParser parser = objectMapper.getFactory().createParser(inputStream)) {
            JsonToken firstToken = parser.nextToken();
            if (firstToken == null) {
                return 0;
            }
            if (firstToken != JsonToken.START_ARRAY) {
                throw new IOException("语料必须是 JSON 数组，实际起始 token: " + firstToken);
            }
            int count = 0;
            JsonToken token;
            while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
                if (token == null) {
                    throw new IOException("语料 JSON 数组未闭合，已读取 " + count + " 篇文档");
                }
                JsonNode node = objectMapper.readTree(parser);
                if (!(node instanceof ObjectNode objectNode)) {
                    throw new IOException("语料第 " + count + " 项不是 JSON 对象: " + (node == null ? "null" : node.getNodeType()));
                }
                consumer.accept(toDocument(objectNode));
                count++;
            }
            return count;
        }
    }

    private Document toDocument(ObjectNode objectNode) {
        List<Zone> fields = new ArrayList<>(objectNode.size());
        Iterator<Map.Entry<String, JsonNode>> iterator = objectNode.fields();
        while (iterator.hasNext()) {
            Map.Entry<String, JsonNode> field = iterator.next();
            fields.add(new Zone(field.getKey(), zoneText(field.getValue())));
        }
        return Document.ofFields(fields);
    }

    private String zoneText(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isValueNode()) {
            return value.asText();
        }
        logger.warn("区域内容不是标量值，按空内容处理: {}", value.getNodeType());
        return "";
    }
}
