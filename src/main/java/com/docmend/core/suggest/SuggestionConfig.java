package com.docmend.core.suggest;

import com.docmend.core.corpus.CorpusIndex;
import com.docmend.core.llm.LlmProperties;
import com.docmend.core.llm.LlmService;
import com.docmend.core.metrics.DocmendMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chooses the primary suggestion strategy once, at startup.
 * <p>
 * AI generation is used only when {@code docmend.llm.enabled=true} and a Spring AI
 * {@code ChatModel} is wired; otherwise the keyword strategy serves every request.
 */
@Configuration
public class SuggestionConfig {

    private static final Logger log = LoggerFactory.getLogger(SuggestionConfig.class);

    @Bean
    public KeywordSuggestionStrategy keywordSuggestionStrategy(CorpusIndex corpusIndex,
                                                               SuggestProperties suggestProperties) {
        return new KeywordSuggestionStrategy(corpusIndex, suggestProperties);
    }

    @Bean
    public SuggestionStrategy primarySuggestionStrategy(LlmService llmService,
                                                        CorpusIndex corpusIndex,
                                                        LlmProperties llmProperties,
                                                        SuggestProperties suggestProperties,
                                                        DocmendMetrics metrics,
                                                        KeywordSuggestionStrategy keywordSuggestionStrategy) {
        if (llmService.isAvailable()) {
            log.info("Suggestion strategy: AI with keyword fallback");
            return new AiSuggestionStrategy(llmService, corpusIndex, llmProperties, suggestProperties, metrics);
        }
        log.info("Suggestion strategy: keyword matching (no AI model enabled)");
        return keywordSuggestionStrategy;
    }
}
