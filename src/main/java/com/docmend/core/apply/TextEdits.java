package com.docmend.core.apply;

import com.docmend.core.corpus.TextLines;

import java.util.ArrayList;
import java.util.List;

/**
 * Pure text mutations used by {@link ApplyEngine}. Both operate on the full file
 * content and return the full new content.
 */
public final class TextEdits {

    private TextEdits() {}

    /**
     * Returns {@code true} when {@code lineNumber} addresses an existing line.
     */
    public static boolean isAnchored(String content, Integer lineNumber) {
        return lineNumber != null && lineNumber >= 1 && lineNumber <= TextLines.split(content).size();
    }

    /**
     * Replaces the content of line {@code lineNumber} (1-based) with {@code text},
     * keeping the line's {@code \r} terminator if it had one.
     */
    public static String replaceLine(String content, int lineNumber, String text) {
        List<String> lines = new ArrayList<>(TextLines.split(content));
        if (lineNumber < 1 || lineNumber > lines.size()) {
            throw new IllegalArgumentException("line " + lineNumber + " out of range 1.." + lines.size());
        }
        String old = lines.get(lineNumber - 1);
        lines.set(lineNumber - 1, old.endsWith("\r") ? text + "\r" : text);
        String joined = String.join("\n", lines);
        return content.endsWith("\n") ? joined + "\n" : joined;
    }

    /**
     * Appends {@code text} as a trailing section separated by one blank line.
     */
    public static String append(String content, String text) {
        var sb = new StringBuilder(content);
        if (!content.isEmpty()) {
            if (!content.endsWith("\n")) {
                sb.append('\n');
            }
            sb.append('\n');
        }
        sb.append(text);
        if (!text.endsWith("\n")) {
            sb.append('\n');
        }
        return sb.toString();
    }
}
