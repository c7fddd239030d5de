package com.docmend.core.suggest;

import com.docmend.core.model.SuggestionDraft;

import java.util.List;

/**
 * One way of turning a query into suggestion drafts. Implementations do not
 * number their output; {@link SuggestionGenerator} does.
 */
public interface SuggestionStrategy {

    /**
     * Short tag used in logs and metrics, e.g. {@code "ai"} or {@code "fallback"}.
     */
    String source();

    /**
     * @param query non-blank, trimmed query
     * @return drafts in presentation order
     */
    List<SuggestionDraft> suggest(String query);
}
