package com.zonesearch.storage;

import com.zonesearch.ErrorKind;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * 索引目录或其中的索引文件不存在。
 */
public class IndexFilesNotFoundException extends IOException {
    private final List<Path> missingFiles;

    public IndexFilesNotFoundException(List<Path> missingFiles) {
        super("找不到索引文件: " + missingFiles + "，请先运行 build 或确认索引目录路径");
        this.missingFiles = List.copyOf(missingFiles);
    }

    public ErrorKind getKind() {
        return ErrorKind.INDEX_FILES_NOT_FOUND;
    }

    public List<Path> getMissingFiles() {
        return missingFiles;
    }
}
