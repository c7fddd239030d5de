package com.docmend.core.suggest;

import com.docmend.core.corpus.CorpusIndex;
import com.docmend.core.corpus.QueryKeywords;
import com.docmend.core.corpus.SectionExtractor;
import com.docmend.core.corpus.TextLines;
import com.docmend.core.model.DocumentFile;
import com.docmend.core.model.SuggestionDraft;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic keyword matcher used when no AI model is available, and as the
 * fallback when the AI path fails.
 * <p>
 * Emits at most one suggestion per file, anchored at the first line that mentions
 * any query keyword. Output is ordered by file path and capped at
 * {@code docmend.suggest.max-suggestions}.
 */
public class KeywordSuggestionStrategy implements SuggestionStrategy {

    static final String TEMPLATE = "Review and update the mention of '%s' near line %d based on: %s";

    private final CorpusIndex corpusIndex;
    private final SuggestProperties properties;

    public KeywordSuggestionStrategy(CorpusIndex corpusIndex, SuggestProperties properties) {
        this.corpusIndex = corpusIndex;
        this.properties = properties;
    }

    @Override
    public String source() {
        return "fallback";
    }

    @Override
    public List<SuggestionDraft> suggest(String query) {
        List<String> keywords = QueryKeywords.of(query);
        if (keywords.isEmpty()) {
            return List.of();
        }
        var drafts = new ArrayList<SuggestionDraft>();
        // listFiles() is sorted by path and lines are scanned top-down
        for (DocumentFile file : corpusIndex.listFiles()) {
            if (drafts.size() >= properties.getMaxSuggestions()) {
                break;
            }
            SuggestionDraft draft = firstMatch(file, keywords, query);
            if (draft != null) {
                drafts.add(draft);
            }
        }
        return drafts;
    }

    private static SuggestionDraft firstMatch(DocumentFile file, List<String> keywords, String query) {
        String heading = null;
        List<String> lines = TextLines.split(file.content());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            String title = SectionExtractor.headingTitle(line);
            if (title != null) {
                heading = title;
            }
            String lower = line.toLowerCase(Locale.ROOT);
            for (String keyword : keywords) {
                if (lower.contains(keyword)) {
                    int lineNumber = i + 1;
                    return new SuggestionDraft(
                            heading != null ? heading : file.name(),
                            String.format(TEMPLATE, keyword, lineNumber, query),
                            file.path(),
                            lineNumber);
                }
            }
        }
        return null;
    }
}
