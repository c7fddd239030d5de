package com.docmend.core.corpus;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns a free-text query into lowercase search keywords.
 * <p>
 * Identifier characters ({@code _} and {@code -}) are kept inside a keyword so
 * that terms like {@code as_tool} survive tokenisation.
 */
public final class QueryKeywords {

    public static final int MIN_LENGTH = 3;

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "with", "that", "this", "from", "into", "onto", "are",
            "was", "were", "will", "would", "should", "could", "can", "not", "but", "all",
            "any", "our", "your", "their", "its", "has", "have", "had", "about", "there",
            "then", "than", "them", "they", "these", "those", "what", "when", "where",
            "which", "who", "why", "how", "also", "just", "some", "more", "most", "such",
            "use", "uses", "using", "please", "make", "docs", "documentation", "update",
            "change", "new", "old", "instead", "replace", "rename", "remove", "delete",
            "add", "rewrite", "mention", "mentions", "reference", "references"
    );

    private QueryKeywords() {}

    public static List<String> of(String query) {
        if (query == null) {
            return List.of();
        }
        var keywords = new LinkedHashSet<String>();
        for (String token : query.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}_-]+")) {
            String word = trimPunctuation(token);
            if (word.length() >= MIN_LENGTH && !STOP_WORDS.contains(word)) {
                keywords.add(word);
            }
        }
        return new ArrayList<>(keywords);
    }

    private static String trimPunctuation(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && (token.charAt(start) == '-' || token.charAt(start) == '_')) start++;
        while (end > start && (token.charAt(end - 1) == '-' || token.charAt(end - 1) == '_')) end--;
        return token.substring(start, end);
    }
}
