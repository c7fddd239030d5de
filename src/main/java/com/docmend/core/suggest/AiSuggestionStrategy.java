package com.docmend.core.suggest;

import com.docmend.core.corpus.CorpusIndex;
import com.docmend.core.llm.LlmProperties;
import com.docmend.core.llm.LlmService;
import com.docmend.core.metrics.DocmendMetrics;
import com.docmend.core.model.RelevantSection;
import com.docmend.core.model.SuggestionDraft;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Asks the configured LLM for suggestions.
 * <p>
 * The prompt carries the query, an outline of the corpus (paths and headings only)
 * and short excerpts of the most relevant sections, never full file bodies.
 * Provider failures propagate as {@link com.docmend.core.llm.LlmUnavailableException}
 * and unusable replies as {@link com.docmend.core.llm.LlmParseException}.
 */
public class AiSuggestionStrategy implements SuggestionStrategy {

    static final int EXCERPT_CHARS = 200;

    static final String SYSTEM_PROMPT = """
            You are an expert technical writer maintaining a body of Markdown documentation.
            Given an update request and an outline of the documentation, propose specific,
            actionable edits. Each edit targets one location.

            Respond with a JSON array only. Each element is an object with:
            - section: the heading or area the edit belongs to
            - suggestion: the exact replacement text for the target line, or the text to append
            - file_path: the file path exactly as listed in the outline, if known
            - line_number: the 1-based line to replace, if known; omit to append instead
            """;

    private final LlmService llmService;
    private final CorpusIndex corpusIndex;
    private final LlmProperties llmProperties;
    private final SuggestProperties suggestProperties;
    private final DocmendMetrics metrics;
    private final SuggestionResponseParser parser = new SuggestionResponseParser();

    public AiSuggestionStrategy(LlmService llmService, CorpusIndex corpusIndex, LlmProperties llmProperties,
                                SuggestProperties suggestProperties, DocmendMetrics metrics) {
        this.llmService = llmService;
        this.corpusIndex = corpusIndex;
        this.llmProperties = llmProperties;
        this.suggestProperties = suggestProperties;
        this.metrics = metrics;
    }

    @Override
    public String source() {
        return "ai";
    }

    @Override
    public List<SuggestionDraft> suggest(String query) {
        List<RelevantSection> relevant = corpusIndex.findRelevantSections(query, llmProperties.getContextSections());
        String userPrompt = buildUserPrompt(query, corpusIndex.outline(llmProperties.getMaxOutlineChars()), relevant);

        long start = System.currentTimeMillis();
        String reply;
        try {
            reply = llmService.complete(SYSTEM_PROMPT, userPrompt);
        } finally {
            metrics.recordLlmDuration(System.currentTimeMillis() - start);
        }

        List<SuggestionDraft> drafts = withFilePaths(parser.parse(reply), relevant);
        int max = suggestProperties.getMaxSuggestions();
        return drafts.size() > max ? List.copyOf(drafts.subList(0, max)) : drafts;
    }

    static String buildUserPrompt(String query, String outline, List<RelevantSection> relevant) {
        var sb = new StringBuilder();
        sb.append("Update request: ").append(query).append("\n\n");
        sb.append("Documentation outline (path, then headings with line numbers):\n");
        sb.append(outline.isBlank() ? "(no documentation files found)\n" : outline);
        sb.append("\nRelevant sections:\n");
        if (relevant.isEmpty()) {
            sb.append("No specific documentation content found.\n");
        }
        for (RelevantSection r : relevant) {
            String body = r.section().content();
            sb.append("File: ").append(r.filePath()).append('\n');
            sb.append("Section: ").append(r.section().title())
                    .append(" (lines ").append(r.section().startLine()).append('-')
                    .append(r.section().endLine()).append(")\n");
            sb.append("Content: ")
                    .append(body.length() > EXCERPT_CHARS ? body.substring(0, EXCERPT_CHARS) + "..." : body)
                    .append("\n---\n");
        }
        return sb.toString();
    }

    /**
     * Fills in a missing file path when the suggestion's section title names a
     * relevant section.
     */
    static List<SuggestionDraft> withFilePaths(List<SuggestionDraft> drafts, List<RelevantSection> relevant) {
        Map<String, String> fileBySection = new HashMap<>();
        for (RelevantSection r : relevant) {
            fileBySection.putIfAbsent(r.section().title().toLowerCase(Locale.ROOT), r.filePath());
        }
        var result = new ArrayList<SuggestionDraft>(drafts.size());
        for (SuggestionDraft d : drafts) {
            String file = d.filePath();
            if (file == null) {
                file = fileBySection.get(d.section().toLowerCase(Locale.ROOT));
            }
            result.add(new SuggestionDraft(d.section(), d.suggestionText(), file, d.lineNumber()));
        }
        return result;
    }
}
