package com.docmend.core.corpus;

import com.docmend.core.model.DocumentSection;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits Markdown text into heading-delimited sections. Only ATX headings
 * ({@code #} to {@code ######}) are recognised; everything else is opaque text.
 */
public final class SectionExtractor {

    private static final Pattern HEADING = Pattern.compile("^(#{1,6})\\s+(.+?)\\s*$");

    private SectionExtractor() {}

    /**
     * Returns the heading title if {@code line} is a heading, otherwise {@code null}.
     */
    public static String headingTitle(String line) {
        Matcher m = HEADING.matcher(stripCarriageReturn(line));
        return m.matches() ? m.group(2) : null;
    }

    public static List<DocumentSection> extract(List<String> lines) {
        var sections = new ArrayList<DocumentSection>();
        String title = null;
        int level = 0;
        int startLine = 0;
        var body = new StringBuilder();

        for (int i = 0; i < lines.size(); i++) {
            String line = stripCarriageReturn(lines.get(i));
            Matcher m = HEADING.matcher(line);
            if (m.matches()) {
                if (title != null) {
                    sections.add(new DocumentSection(title, level, startLine, i, body.toString().strip()));
                }
                title = m.group(2);
                level = m.group(1).length();
                startLine = i + 1;
                body.setLength(0);
            } else if (title != null) {
                body.append(line).append('\n');
            }
        }
        if (title != null) {
            sections.add(new DocumentSection(title, level, startLine, lines.size(), body.toString().strip()));
        }
        return sections;
    }

    static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
