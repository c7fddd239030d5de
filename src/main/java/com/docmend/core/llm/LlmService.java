package com.docmend.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thin wrapper around Spring AI's {@link ChatClient} that sends one system + user
 * prompt and returns the raw reply text.
 * <p>
 * Every call runs on a small dedicated pool and is bounded by
 * {@code docmend.llm.timeout-seconds}. Any provider failure (no model configured,
 * timeout, network, quota, blank reply) surfaces as {@link LlmUnavailableException}
 * so callers can degrade instead of failing.
 */
@Service
public class LlmService implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;
    private final LlmProperties properties;
    private final ExecutorService executor;

    @Autowired
    public LlmService(ObjectProvider<ChatModel> chatModel, LlmProperties properties) {
        this(createClient(chatModel.getIfAvailable()), properties);
    }

    LlmService(ChatClient chatClient, LlmProperties properties) {
        this.chatClient = chatClient;
        this.properties = properties;
        this.executor = Executors.newFixedThreadPool(Math.max(1, properties.getMaxConcurrentCalls()), daemonThreads());
        log.info("LlmService initialized — chat model {}, enabled={}, timeout {}s",
                chatClient != null ? "present" : "absent", properties.isEnabled(), properties.getTimeoutSeconds());
    }

    /**
     * Returns {@code true} when AI generation is switched on and a chat model is wired.
     */
    public boolean isAvailable() {
        return properties.isEnabled() && chatClient != null;
    }

    /**
     * Sends a system + user prompt to the LLM and returns the reply text.
     *
     * @param systemPrompt instructions for the LLM's role / behaviour
     * @param userPrompt   the request text, including any corpus context
     * @return the non-blank reply content
     * @throws LlmUnavailableException if the model is absent, fails, or exceeds the timeout
     */
    public String complete(String systemPrompt, String userPrompt) {
        if (!isAvailable()) {
            throw new LlmUnavailableException("No chat model configured");
        }
        log.info("LLM call started ({} prompt chars)", systemPrompt.length() + userPrompt.length());
        long start = System.currentTimeMillis();

        Future<String> future = executor.submit(() -> chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt)
                .options(ChatOptions.builder()
                        .temperature(properties.getTemperature())
                        .maxTokens(properties.getMaxTokens())
                        .build())
                .call()
                .content());

        String response;
        try {
            response = future.get(properties.getTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new LlmUnavailableException("LLM call timed out after " + properties.getTimeoutSeconds() + "s", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new LlmUnavailableException("LLM call interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new LlmUnavailableException("LLM call failed: " + cause.getMessage(), cause);
        }

        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete ({}s)", String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content. "
                    + "Check that the model is running and reachable.");
        }
        return response;
    }

    @Override
    public void destroy() {
        executor.shutdownNow();
    }

    private static ChatClient createClient(ChatModel chatModel) {
        return chatModel != null ? ChatClient.create(chatModel) : null;
    }

    private static java.util.concurrent.ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "docmend-llm-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
