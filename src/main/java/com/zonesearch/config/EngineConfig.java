package com.zonesearch.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 引擎运行时配置
 * 
 * 由 CLI 参数注入，覆盖 Constants 默认值
 */
public class EngineConfig {
    private Path indexDir = Paths.get("./" + Constants.INDEX_FOLDER_NAME);
    private int resultLimit = Constants.DEFAULT_RESULT_LIMIT;
    private char phraseStart = Constants.DEFAULT_PHRASE_START;
    private char phraseEnd = Constants.DEFAULT_PHRASE_END;

    public Path getIndexDir() {
        return indexDir;
    }

    public void setIndexDir(Path indexDir) {
        this.indexDir = indexDir;
    }

    public int getResultLimit() {
        return resultLimit;
    }

    public void setResultLimit(int resultLimit) {
        this.resultLimit = resultLimit;
    }

    public char getPhraseStart() {
        return phraseStart;
    }

    public void setPhraseStart(char phraseStart) {
        this.phraseStart = phraseStart;
    }

    public char getPhraseEnd() {
        return phraseEnd;
    }

    public void setPhraseEnd(char phraseEnd) {
        this.phraseEnd = phraseEnd;
    }

    /**
     * 使用默认配置创建实例
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }
}
