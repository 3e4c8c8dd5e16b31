package com.ovsdb.modelgen.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes the layout of rendered Java source.
 *
 * <ul>
 *   <li>every line is re-indented by brace depth, four spaces per level;</li>
 *   <li>trailing whitespace is removed;</li>
 *   <li>runs of blank lines collapse to one, and blank lines are dropped at the
 *       start and end of the file, after an opening brace and before a closing
 *       brace;</li>
 *   <li>the result ends with exactly one newline.</li>
 * </ul>
 *
 * Braces inside comments, string and character literals are ignored.
 * Text blocks are not supported.
 */
public class JavaSourceFormatter {

    private static final String INDENT = "    ";

    public String format(String source) {
        List<String> out = new ArrayList<>();
        int depth = 0;
        boolean inBlockComment = false;
        boolean pendingBlank = false;

        for (String rawLine : source.split("\r?\n", -1)) {
            String line = rawLine.strip();
            if (line.isEmpty()) {
                pendingBlank = !out.isEmpty();
                continue;
            }

            boolean closesBlock = !inBlockComment && line.startsWith("}");
            if (pendingBlank && !closesBlock && !out.get(out.size() - 1).endsWith("{")) {
                out.add("");
            }
            pendingBlank = false;

            int level = Math.max(0, closesBlock ? depth - 1 : depth);
            boolean commentContinuation = inBlockComment && line.startsWith("*");
            out.add(INDENT.repeat(level) + (commentContinuation ? " " : "") + line);

            LineScan scan = scan(line, inBlockComment);
            depth = Math.max(0, depth + scan.braceDelta);
            inBlockComment = scan.inBlockComment;
        }

        if (out.isEmpty()) {
            return "";
        }
        return String.join("\n", out) + "\n";
    }

    private static LineScan scan(String line, boolean inBlockComment) {
        int delta = 0;
        int i = 0;
        int length = line.length();
        while (i < length) {
            char c = line.charAt(i);
            if (inBlockComment) {
                if (c == '*' && i + 1 < length && line.charAt(i + 1) == '/') {
                    inBlockComment = false;
                    i += 2;
                } else {
                    i++;
                }
                continue;
            }
            if (c == '/' && i + 1 < length) {
                char next = line.charAt(i + 1);
                if (next == '/') {
                    break;
                }
                if (next == '*') {
                    inBlockComment = true;
                    i += 2;
                    continue;
                }
            }
            if (c == '"' || c == '\'') {
                i = skipLiteral(line, i, c);
                continue;
            }
            if (c == '{') {
                delta++;
            } else if (c == '}') {
                delta--;
            }
            i++;
        }
        return new LineScan(delta, inBlockComment);
    }

    // index just past the closing quote, or the end of the line if unterminated
    private static int skipLiteral(String line, int start, char quote) {
        int i = start + 1;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                return i + 1;
            }
            i++;
        }
        return line.length();
    }

    private record LineScan(int braceDelta, boolean inBlockComment) {
    }
}
