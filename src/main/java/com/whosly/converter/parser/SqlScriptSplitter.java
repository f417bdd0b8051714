package com.whosly.converter.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a script at top-level semicolons, ignoring those inside strings, quoted identifiers,
 * dollar-quoted bodies and comments.
 */
public final class SqlScriptSplitter {

    private SqlScriptSplitter() {
    }

    /**
     * A statement's text and the line its first code character is on.
     */
    public static final class Segment {
        private final String text;
        private final int startLine;

        Segment(String text, int startLine) {
            this.text = text;
            this.startLine = startLine;
        }

        public String getText() {
            return text;
        }

        public int getStartLine() {
            return startLine;
        }
    }

    /**
     * @param script script text with LF line endings
     * @return statements without their terminators; comment-only chunks are dropped
     */
    public static List<Segment> split(String script) {
        List<Segment> out = new ArrayList<>();
        if (script == null || script.isEmpty()) {
            return out;
        }

        int segmentStart = 0;
        int firstCodeLine = -1;
        int line = 1;
        int pos = 0;
        int length = script.length();

        while (pos < length) {
            char ch = script.charAt(pos);
            if (ch == '\n') {
                line++;
                pos++;
                continue;
            }
            if (Character.isWhitespace(ch)) {
                pos++;
                continue;
            }
            if (script.startsWith("--", pos)) {
                pos = skipLineComment(script, pos);
                continue;
            }
            if (script.startsWith("/*", pos)) {
                int end = skipBlockComment(script, pos);
                line += countNewlines(script, pos, end);
                pos = end;
                continue;
            }

            if (firstCodeLine < 0) {
                firstCodeLine = line;
            }
            if (ch == ';') {
                addSegment(out, script.substring(segmentStart, pos), firstCodeLine);
                segmentStart = pos + 1;
                firstCodeLine = -1;
                pos++;
                continue;
            }

            int end = pos + 1;
            if (ch == '\'' || ch == '"') {
                end = skipQuoted(script, pos, ch);
            } else if (script.startsWith("$$", pos)) {
                int close = script.indexOf("$$", pos + 2);
                end = close < 0 ? length : close + 2;
            }
            line += countNewlines(script, pos, end);
            pos = end;
        }

        if (firstCodeLine > 0) {
            addSegment(out, script.substring(segmentStart), firstCodeLine);
        }
        return out;
    }

    /**
     * Removes line and block comments outside quoted text.
     */
    public static String stripComments(String sql) {
        StringBuilder sb = new StringBuilder(sql.length());
        int pos = 0;
        while (pos < sql.length()) {
            char ch = sql.charAt(pos);
            if (sql.startsWith("--", pos)) {
                pos = skipLineComment(sql, pos);
            } else if (sql.startsWith("/*", pos)) {
                pos = skipBlockComment(sql, pos);
                sb.append(' ');
            } else if (ch == '\'' || ch == '"') {
                int end = skipQuoted(sql, pos, ch);
                sb.append(sql, pos, end);
                pos = end;
            } else {
                sb.append(ch);
                pos++;
            }
        }
        return sb.toString();
    }

    private static void addSegment(List<Segment> out, String text, int startLine) {
        String trimmed = text.trim();
        if (!trimmed.isEmpty()) {
            out.add(new Segment(trimmed, startLine));
        }
    }

    private static int skipLineComment(String s, int pos) {
        int end = s.indexOf('\n', pos);
        return end < 0 ? s.length() : end;
    }

    private static int skipBlockComment(String s, int pos) {
        int end = s.indexOf("*/", pos + 2);
        return end < 0 ? s.length() : end + 2;
    }

    private static int skipQuoted(String s, int pos, char quote) {
        int i = pos + 1;
        while (i < s.length()) {
            if (s.charAt(i) == quote) {
                if (i + 1 < s.length() && s.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return s.length();
    }

    private static int countNewlines(String s, int from, int to) {
        int count = 0;
        for (int i = from; i < to; i++) {
            if (s.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }
}
