package com.zonesearch.index;

import java.util.Arrays;

/**
 * 倒排列表，包含文档ID与每个文档内的词项位置。
 *
 * @param docIds 严格递增的文档ID数组
 * @param positions 与docIds同长度，每项为该文档内严格递增的位置数组
 */
public record PostingList(int[] docIds, int[][] positions) {
    /**
     * 构造时执行校验并复制输入数据，避免外部修改。
     */
    public PostingList {
        if (docIds == null || positions == null) {
            throw new IllegalArgumentException("docIds与positions不能为null");
        }
        if (docIds.length != positions.length) {
            throw new IllegalArgumentException("docIds与positions长度不一致: " + docIds.length + " vs " + positions.length);
        }
        int[][] copiedPositions = new int[positions.length][];
        for (int index = 0; index < docIds.length; index++) {
            if (docIds[index] < 0) {
                throw new IllegalArgumentException("docId不能为负数，位置=" + index + ", value=" + docIds[index]);
            }
            if (index > 0 && docIds[index] <= docIds[index - 1]) {
                throw new IllegalArgumentException("docIds必须严格递增，位置=" + index + ", current=" + docIds[index]);
            }
            copiedPositions[index] = checkedPositions(docIds[index], positions[index]);
        }
        docIds = Arrays.copyOf(docIds, docIds.length);
        positions = copiedPositions;
    }

    private static int[] checkedPositions(int docId, int[] docPositions) {
        if (docPositions == null || docPositions.length == 0) {
            throw new IllegalArgumentException("位置列表不能为空，docId=" + docId);
        }
        for (int index = 0; index < docPositions.length; index++) {
            if (docPositions[index] < 0) {
                throw new IllegalArgumentException("位置不能为负数，docId=" + docId + ", value=" + docPositions[index]);
            }
            if (index > 0 && docPositions[index] <= docPositions[index - 1]) {
                throw new IllegalArgumentException("位置必须严格递增，docId=" + docId + ", current=" + docPositions[index]);
            }
        }
        return Arrays.copyOf(docPositions, docPositions.length);
    }

    /**
     * 返回倒排项数量，即文档频率。
     *
     * @return 倒排项数量
     */
    public int size() {
        return docIds.length;
    }

    /**
     * 获取指定位置的文档ID。
     *
     * @param index 倒排项下标
     * @return 文档ID
     */
    public int docId(int index) {
        return docIds[index];
    }

    /**
     * 获取指定倒排项的词频。
     *
     * @param index 倒排项下标
     * @return 词频
     */
    public int termFreq(int index) {
        return positions[index].length;
    }

    /**
     * 获取指定倒排项的位置数组副本。
     *
     * @param index 倒排项下标
     * @return 位置数组
     */
    public int[] positions(int index) {
        return Arrays.copyOf(positions[index], positions[index].length);
    }

    /**
     * 二分查找文档ID所在下标，未命中时返回负数。
     *
     * @param docId 文档ID
     * @return 倒排项下标或负数
     */
    public int indexOf(int docId) {
        return Arrays.binarySearch(docIds, docId);
    }

    public boolean contains(int docId) {
        return indexOf(docId) >= 0;
    }

    /**
     * 判断文档在指定位置是否出现该词项。
     */
    public boolean hasPosition(int docId, int position) {
        int index = indexOf(docId);
        return index >= 0 && Arrays.binarySearch(positions[index], position) >= 0;
    }

    /**
     * 获取文档内的位置数组，文档不在列表中时返回空数组。
     */
    public int[] positionsFor(int docId) {
        int index = indexOf(docId);
        return index < 0 ? new int[0] : positions(index);
    }

    @Override
    public int[] docIds() {
        return Arrays.copyOf(docIds, docIds.length);
    }

    @Override
    public int[][] positions() {
        int[][] copy = new int[positions.length][];
        for (int index = 0; index < positions.length; index++) {
            copy[index] = positions(index);
        }
        return copy;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PostingList that)) {
            return false;
        }
        return Arrays.equals(docIds, that.docIds) && Arrays.deepEquals(positions, that.positions);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(docIds) + Arrays.deepHashCode(positions);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("PostingList[");
        for (int index = 0; index < docIds.length; index++) {
            if (index > 0) {
                builder.append("; ");
            }
            builder.append(docIds[index]).append(':').append(Arrays.toString(positions[index]));
        }
        return builder.append(']').toString();
    }
}
