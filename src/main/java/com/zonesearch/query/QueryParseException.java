package com.zonesearch.query;

import com.zonesearch.ErrorKind;

public class QueryParseException extends RuntimeException {
    private final ErrorKind kind;
    private final int position;
    private final String queryString;
    private final String suggestion;

    public QueryParseException(String message, int position, String queryString) {
        this(ErrorKind.MALFORMED_PHRASE_DELIMITER, message, position, queryString);
    }

    public QueryParseException(ErrorKind kind, String message, int position, String queryString) {
        super(buildMessage(message, position, queryString == null ? "" : queryString));
        this.kind = kind;
        this.position = position;
        this.queryString = queryString == null ? "" : queryString;
        this.suggestion = suggestFix(kind, this.queryString);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public int getPosition() {
        return position;
    }

    public String getQueryString() {
        return queryString;
    }

    public String getSuggestion() {
        return suggestion;
    }

    private static String buildMessage(String message, int pos, String query) {
        int caretPos = Math.max(0, Math.min(pos, query.length()));
        String pointer = " ".repeat(caretPos) + "^";
        return "Parse error at position " + pos + ": " + message + System.lineSeparator()
                + query + System.lineSeparator() + pointer;
    }

    private static String suggestFix(ErrorKind kind, String query) {
        if (query.isBlank()) {
            return "请输入非空查询";
        }
        if (kind == ErrorKind.MALFORMED_PHRASE_DELIMITER) {
            return "短语分隔符必须紧贴短语首词开头与末词结尾，且成对出现，例如 :quick fox:";
        }
        return "请检查该位置附近的查询语法";
    }
}
