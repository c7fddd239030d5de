package com.docmend.core.corpus;

import java.util.Arrays;
import java.util.List;

/**
 * Line splitting shared by the corpus reader and the apply pipeline.
 * <p>
 * Lines are split on {@code \n}; a trailing {@code \r} stays on its line. A final
 * newline does not start an extra line, so {@code "a\nb\n"} has two lines.
 */
public final class TextLines {

    private TextLines() {}

    public static List<String> split(String content) {
        if (content.isEmpty()) {
            return List.of();
        }
        String body = content.endsWith("\n") ? content.substring(0, content.length() - 1) : content;
        return Arrays.asList(body.split("\n", -1));
    }
}
