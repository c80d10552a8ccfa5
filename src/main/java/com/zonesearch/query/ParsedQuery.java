package com.zonesearch.query;

import java.util.ArrayList;
import java.util.List;

/**
 * 解析后的查询：按出现顺序排列的查询原子。
 */
public record ParsedQuery(List<QueryAtom> atoms) {

    public ParsedQuery {
        atoms = List.copyOf(atoms);
    }

    /**
     * 展开全部关键词出现，短语中的词逐个计入，同一个词出现多次就计多次。
     */
    public List<String> keywords() {
        List<String> keywords = new ArrayList<>();
        for (QueryAtom atom : atoms) {
            keywords.addAll(atom.terms());
        }
        return keywords;
    }

    public List<QueryAtom.Phrase> phrases() {
        List<QueryAtom.Phrase> phrases = new ArrayList<>();
        for (QueryAtom atom : atoms) {
            if (atom instanceof QueryAtom.Phrase phrase) {
                phrases.add(phrase);
            }
        }
        return phrases;
    }

    public boolean hasPhrases() {
        for (QueryAtom atom : atoms) {
            if (atom instanceof QueryAtom.Phrase) {
                return true;
            }
        }
        return false;
    }
}
