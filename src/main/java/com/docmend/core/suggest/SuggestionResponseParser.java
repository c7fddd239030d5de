package com.docmend.core.suggest;

import com.docmend.core.llm.LlmParseException;
import com.docmend.core.model.SuggestionDraft;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts a raw LLM reply into suggestion drafts.
 * <p>
 * The first JSON array of objects in the reply is preferred; bracketed prose before
 * it such as {@code [Note]} is skipped. Replies without one are read as a numbered
 * or bulleted list. A reply that yields nothing usable raises {@link LlmParseException}.
 */
public class SuggestionResponseParser {

    private static final Logger log = LoggerFactory.getLogger(SuggestionResponseParser.class);

    static final String DEFAULT_SECTION = "General";

    private static final Pattern LIST_ITEM = Pattern.compile("^(?:\\d+[.)]|[-*])\\s+(.*)$");

    private final ObjectMapper mapper = JsonMapper.builder()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .build();

    public List<SuggestionDraft> parse(String reply) {
        if (reply == null || reply.isBlank()) {
            throw new LlmParseException("Empty reply");
        }
        var jsonErrors = new ArrayList<String>();
        JsonNode array = findArray(reply, jsonErrors);
        List<SuggestionDraft> drafts = array != null ? fromJson(array) : parseList(reply);
        if (drafts.isEmpty()) {
            throw new LlmParseException(array == null && !jsonErrors.isEmpty()
                    ? "Malformed JSON array: " + jsonErrors.get(0)
                    : "Reply contained no usable suggestions");
        }
        return drafts;
    }

    /**
     * Tries every {@code [} in turn and returns the first array holding at least one
     * object, or null.
     */
    private JsonNode findArray(String reply, List<String> errors) {
        for (int i = reply.indexOf('['); i >= 0; i = reply.indexOf('[', i + 1)) {
            JsonNode node;
            try {
                // readTree stops after the first value, so trailing prose is ignored
                node = mapper.readTree(reply.substring(i));
            } catch (Exception e) {
                errors.add(e.getMessage());
                continue;
            }
            if (node == null || !node.isArray()) {
                continue;
            }
            for (JsonNode item : node) {
                if (item.isObject()) {
                    return node;
                }
            }
        }
        return null;
    }

    private List<SuggestionDraft> fromJson(JsonNode root) {
        var drafts = new ArrayList<SuggestionDraft>();
        for (JsonNode item : root) {
            if (!item.isObject()) {
                continue;
            }
            String text = firstText(item, "suggestion", "suggestion_text", "suggestionText", "text");
            if (text == null) {
                log.debug("Dropping suggestion without text: {}", item);
                continue;
            }
            String section = firstText(item, "section", "title");
            drafts.add(new SuggestionDraft(
                    section != null ? section : DEFAULT_SECTION,
                    text,
                    firstText(item, "file_path", "filePath", "file"),
                    lineNumber(item)));
        }
        return drafts;
    }

    private static List<SuggestionDraft> parseList(String reply) {
        var drafts = new ArrayList<SuggestionDraft>();
        StringBuilder current = null;
        for (String raw : reply.split("\n")) {
            String line = raw.strip();
            Matcher m = LIST_ITEM.matcher(line);
            if (m.matches()) {
                addIfPresent(drafts, current);
                current = new StringBuilder(m.group(1).strip());
            } else if (current != null && !line.isEmpty()) {
                current.append(' ').append(line);
            }
        }
        addIfPresent(drafts, current);
        return drafts;
    }

    private static void addIfPresent(List<SuggestionDraft> drafts, StringBuilder text) {
        if (text != null && !text.toString().isBlank()) {
            drafts.add(new SuggestionDraft(DEFAULT_SECTION, text.toString(), null, null));
        }
    }

    private static String firstText(JsonNode item, String... names) {
        for (String name : names) {
            JsonNode node = item.get(name);
            if (node != null && !node.isNull()) {
                String value = node.asText().strip();
                if (!value.isEmpty()) {
                    return value;
                }
            }
        }
        return null;
    }

    private static Integer lineNumber(JsonNode item) {
        JsonNode node = item.has("line_number") ? item.get("line_number") : item.get("lineNumber");
        if (node == null || node.isNull()) {
            return null;
        }
        int value;
        if (node.isNumber()) {
            value = node.asInt();
        } else {
            try {
                value = Integer.parseInt(node.asText().strip());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return value >= 1 ? value : null;
    }
}
