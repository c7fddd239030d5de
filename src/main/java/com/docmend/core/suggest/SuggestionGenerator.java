package com.docmend.core.suggest;

import com.docmend.core.llm.LlmParseException;
import com.docmend.core.llm.LlmUnavailableException;
import com.docmend.core.metrics.DocmendMetrics;
import com.docmend.core.model.Suggestion;
import com.docmend.core.model.SuggestionDraft;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Produces numbered suggestions for a query.
 * <p>
 * Runs the primary strategy chosen in {@link SuggestionConfig}. When that strategy
 * cannot reach its model or cannot parse the reply, the keyword strategy runs
 * instead and the caller never sees the failure.
 */
@Service
public class SuggestionGenerator {

    private static final Logger log = LoggerFactory.getLogger(SuggestionGenerator.class);

    private final SuggestionStrategy primary;
    private final KeywordSuggestionStrategy fallback;
    private final DocmendMetrics metrics;

    public SuggestionGenerator(@Qualifier("primarySuggestionStrategy") SuggestionStrategy primary,
                               @Qualifier("keywordSuggestionStrategy") KeywordSuggestionStrategy fallback,
                               DocmendMetrics metrics) {
        this.primary = primary;
        this.fallback = fallback;
        this.metrics = metrics;
    }

    /**
     * @param query free-text description of the desired documentation change
     * @return suggestions with ids {@code 1..n}, possibly empty
     * @throws InvalidInputException if the query is null or blank
     */
    public List<Suggestion> generate(String query) {
        if (query == null || query.isBlank()) {
            throw new InvalidInputException("Query must not be empty");
        }
        String trimmed = query.strip();

        SuggestionStrategy used = primary;
        List<SuggestionDraft> drafts;
        try {
            drafts = primary.suggest(trimmed);
        } catch (LlmUnavailableException e) {
            log.warn("AI suggestions unavailable, using keyword fallback: {}", e.getMessage());
            metrics.recordFallback("unavailable");
            used = fallback;
            drafts = fallback.suggest(trimmed);
        } catch (LlmParseException e) {
            log.warn("AI reply unusable, using keyword fallback: {}", e.getMessage());
            metrics.recordFallback("parse");
            used = fallback;
            drafts = fallback.suggest(trimmed);
        }

        var suggestions = new ArrayList<Suggestion>(drafts.size());
        for (SuggestionDraft draft : drafts) {
            suggestions.add(draft.toSuggestion(suggestions.size() + 1));
        }
        metrics.recordGeneration(used.source(), suggestions.size());
        log.info("Generated {} suggestion(s) via {}", suggestions.size(), used.source());
        return suggestions;
    }
}
