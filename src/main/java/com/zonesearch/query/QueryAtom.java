package com.zonesearch.query;

import java.util.List;

/**
 * 查询原子：单个关键词或必须连续出现的短语。
 */
public sealed interface QueryAtom permits QueryAtom.Keyword, QueryAtom.Phrase {

    /**
     * 原子展开后的关键词序列，短语保持原有顺序。
     */
    List<String> terms();

    record Keyword(String term) implements QueryAtom {
        @Override
        public List<String> terms() {
            return List.of(term);
        }
    }

    record Phrase(List<String> terms) implements QueryAtom {
        public Phrase {
            if (terms == null || terms.isEmpty()) {
                throw new IllegalArgumentException("短语不能为空");
            }
            terms = List.copyOf(terms);
        }
    }
}
