package com.stockdash.migration;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Splits a rendered SQL script into the statements SQLite would run one after another.
 * <p>
 * Semicolons inside quoted text ({@code '..'}, {@code ".."}, {@code `..`}, {@code [..]}), comments
 * and {@code CREATE TRIGGER ... BEGIN ... END} bodies do not end a statement. Comments are kept
 * with the statement that follows them; segments holding only comments or whitespace are dropped.
 */
final class SqlScript {
    private SqlScript() {
    }

    static List<String> split(String script) {
        List<String> statements = new ArrayList<>();
        if (script == null) {
            return statements;
        }
        int length = script.length();
        int start = 0;
        boolean hasCode = false;
        boolean trigger = false;
        boolean headerChecked = false;
        String lastWord = "";
        int i = 0;
        while (i < length) {
            char c = script.charAt(i);
            if (c == '-' && i + 1 < length && script.charAt(i + 1) == '-') {
                int end = script.indexOf('\n', i);
                i = end < 0 ? length : end + 1;
                continue;
            }
            if (c == '/' && i + 1 < length && script.charAt(i + 1) == '*') {
                int end = script.indexOf("*/", i + 2);
                i = end < 0 ? length : end + 2;
                continue;
            }
            if (c == '\'' || c == '"' || c == '`' || c == '[') {
                char close = c == '[' ? ']' : c;
                int end = script.indexOf(close, i + 1);
                // a doubled quote is an escaped quote
                while (end >= 0 && close != ']' && end + 1 < length && script.charAt(end + 1) == close) {
                    end = script.indexOf(close, end + 2);
                }
                hasCode = true;
                lastWord = "";
                i = end < 0 ? length : end + 1;
                continue;
            }
            if (Character.isLetterOrDigit(c) || c == '_') {
                int end = i;
                while (end < length && (Character.isLetterOrDigit(script.charAt(end)) || script.charAt(end) == '_')) {
                    end++;
                }
                lastWord = script.substring(i, end).toUpperCase(Locale.ROOT);
                hasCode = true;
                if (!headerChecked && "TRIGGER".equals(lastWord)) {
                    trigger = isCreateTrigger(script.substring(start, end));
                    headerChecked = true;
                }
                i = end;
                continue;
            }
            if (c == ';' && (!trigger || "END".equals(lastWord))) {
                if (hasCode) {
                    statements.add(script.substring(start, i).trim());
                }
                start = i + 1;
                hasCode = false;
                trigger = false;
                headerChecked = false;
                lastWord = "";
                i++;
                continue;
            }
            if (!Character.isWhitespace(c)) {
                hasCode = true;
                lastWord = "";
            }
            i++;
        }
        if (hasCode) {
            statements.add(script.substring(start).trim());
        }
        return statements;
    }

    private static boolean isCreateTrigger(String header) {
        String normalized = stripComments(header).trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
        return normalized.startsWith("CREATE TRIGGER")
                || normalized.startsWith("CREATE TEMP TRIGGER")
                || normalized.startsWith("CREATE TEMPORARY TRIGGER");
    }

    private static String stripComments(String sql) {
        return sql.replaceAll("(?s)/\\*.*?\\*/", " ").replaceAll("--[^\\n]*", " ");
    }
}
