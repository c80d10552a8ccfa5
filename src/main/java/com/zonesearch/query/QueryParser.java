package com.zonesearch.query;

import com.zonesearch.ErrorKind;
import com.zonesearch.config.Constants;
import com.zonesearch.text.Tokenizer;
import com.zonesearch.text.WordTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * 查询解析器：按空白切分查询词，被分隔符包围的连续片段解析为短语。
 * 起始分隔符只能紧贴短语首词开头，结束分隔符只能紧贴末词结尾。
 */
public class QueryParser {
    private static final Logger logger = LoggerFactory.getLogger(QueryParser.class);

    private final char phraseStart;
    private final char phraseEnd;
    private final Tokenizer tokenizer;

    public QueryParser() {
        this(Constants.DEFAULT_PHRASE_START, Constants.DEFAULT_PHRASE_END, new WordTokenizer());
    }

    public QueryParser(char phraseStart, char phraseEnd, Tokenizer tokenizer) {
        if (WordTokenizer.isWhitespace(phraseStart) || WordTokenizer.isWhitespace(phraseEnd)) {
            throw new IllegalArgumentException("短语分隔符不能是空白字符");
        }
        this.phraseStart = phraseStart;
        this.phraseEnd = phraseEnd;
        this.tokenizer = tokenizer;
    }

    /**
     * 将查询字符串解析为有序的查询原子。
     */
    public ParsedQuery parse(String query) {
        String queryString = query == null ? "" : query;
        List<Word> words = splitWords(queryString);
        if (words.isEmpty()) {
            throw new QueryParseException(ErrorKind.INVALID_ARGUMENT_COUNT, "查询不能为空", 0, queryString);
        }

        List<QueryAtom> atoms = new ArrayList<>();
        List<String> openPhrase = null;
        int openPhraseOffset = 0;

        for (Word word : words) {
            String value = word.value();
            int lastIndex = value.length() - 1;

            if (openPhrase == null) {
                if (value.charAt(0) != phraseStart) {
                    ensureNoDelimiter(value, word.offset(), queryString);
                    addKeyword(atoms, value);
                    continue;
                }
                if (value.length() == 1) {
                    throw new QueryParseException("起始分隔符与短语首词之间不能有空白", word.offset(), queryString);
                }
                if (value.charAt(lastIndex) == phraseEnd) {
                    String inner = value.substring(1, lastIndex);
                    if (inner.isEmpty()) {
                        throw new QueryParseException("短语不能为空", word.offset(), queryString);
                    }
                    ensureNoDelimiter(inner, word.offset() + 1, queryString);
                    addPhrase(atoms, List.of(inner), word.offset(), queryString);
                    continue;
                }
                String first = value.substring(1);
                ensureNoDelimiter(first, word.offset() + 1, queryString);
                openPhrase = new ArrayList<>();
                openPhrase.add(first);
                openPhraseOffset = word.offset();
                continue;
            }

            if (value.charAt(lastIndex) == phraseEnd) {
                if (value.length() == 1) {
                    throw new QueryParseException("结束分隔符与短语末词之间不能有空白", word.offset(), queryString);
                }
                String last = value.substring(0, lastIndex);
                ensureNoDelimiter(last, word.offset(), queryString);
                openPhrase.add(last);
                addPhrase(atoms, openPhrase, openPhraseOffset, queryString);
                openPhrase = null;
                continue;
            }
            ensureNoDelimiter(value, word.offset(), queryString);
            openPhrase.add(value);
        }

        if (openPhrase != null) {
            throw new QueryParseException("短语未闭合", openPhraseOffset, queryString);
        }
        return new ParsedQuery(atoms);
    }

    private void addKeyword(List<QueryAtom> atoms, String rawWord) {
        String term = tokenizer.normalize(rawWord);
        if (term.isEmpty()) {
            logger.debug("查询词归一化后为空，已忽略: {}", rawWord);
            return;
        }
        atoms.add(new QueryAtom.Keyword(term));
    }

    private void addPhrase(List<QueryAtom> atoms, List<String> rawWords, int offset, String queryString) {
        List<String> terms = new ArrayList<>(rawWords.size());
        for (String rawWord : rawWords) {
            String term = tokenizer.normalize(rawWord);
            if (!term.isEmpty()) {
                terms.add(term);
            }
        }
        if (terms.isEmpty()) {
            throw new QueryParseException("短语归一化后为空", offset, queryString);
        }
        atoms.add(new QueryAtom.Phrase(terms));
    }

    /**
     * 分隔符只允许出现在短语首词开头或末词结尾，其余位置一律视为错误。
     */
    private void ensureNoDelimiter(String text, int baseOffset, String queryString) {
        for (int index = 0; index < text.length(); index++) {
            char currentChar = text.charAt(index);
            if (currentChar == phraseStart || currentChar == phraseEnd) {
                throw new QueryParseException("分隔符位置非法或不成对: " + currentChar, baseOffset + index, queryString);
            }
        }
    }

    private List<Word> splitWords(String query) {
        List<Word> words = new ArrayList<>();
        Matcher wordMatcher = WordTokenizer.WORD_PATTERN.matcher(query);
        while (wordMatcher.find()) {
            words.add(new Word(wordMatcher.group(), wordMatcher.start()));
        }
        return words;
    }

    private record Word(String value, int offset) {
    }
}
