package com.docmend.core.review;

import com.docmend.core.model.ReviewState;
import com.docmend.core.model.ReviewStatus;
import com.docmend.core.model.Suggestion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Review decisions for one generation response.
 * <p>
 * Every operation is idempotent and never fails. Ids that were not part of the
 * response are ignored. Suggestions keep their original id order throughout.
 */
public class ReviewSession {

    private final Map<Integer, Suggestion> suggestions = new LinkedHashMap<>();
    private final Map<Integer, ReviewState> states = new LinkedHashMap<>();

    public ReviewSession(List<Suggestion> suggestions) {
        suggestions.stream()
                .sorted((a, b) -> Integer.compare(a.id(), b.id()))
                .forEach(s -> {
                    this.suggestions.put(s.id(), s);
                    this.states.put(s.id(), ReviewState.PENDING);
                });
    }

    public synchronized void approve(int id) {
        transition(id, ReviewStatus.APPROVED, null);
    }

    public synchronized void reject(int id) {
        transition(id, ReviewStatus.REJECTED, null);
    }

    /**
     * Moves a suggestion to EDITED. The edited text is seeded with the original
     * suggestion text unless an edit is already in progress.
     */
    public synchronized void edit(int id) {
        ReviewState current = states.get(id);
        if (current == null || current.status() == ReviewStatus.EDITED) {
            return;
        }
        transition(id, ReviewStatus.EDITED, suggestions.get(id).suggestionText());
    }

    /**
     * Replaces the edited text. Has no effect unless the suggestion is being edited.
     */
    public synchronized void setEditedText(int id, String text) {
        ReviewState current = states.get(id);
        if (current == null || current.status() != ReviewStatus.EDITED || text == null) {
            return;
        }
        states.put(id, new ReviewState(ReviewStatus.EDITED, text));
    }

    /**
     * Returns the edited text while editing, otherwise the original suggestion text;
     * {@code null} for an unknown id.
     */
    public synchronized String effectiveText(int id) {
        ReviewState state = states.get(id);
        if (state == null) {
            return null;
        }
        return state.status() == ReviewStatus.EDITED ? state.editedText() : suggestions.get(id).suggestionText();
    }

    public synchronized ReviewState state(int id) {
        return states.get(id);
    }

    /**
     * Approved and edited suggestions as originally generated, in id order.
     */
    public synchronized List<Suggestion> approvedOrEdited() {
        var selected = new ArrayList<Suggestion>();
        states.forEach((id, state) -> {
            if (state.isSelected()) {
                selected.add(suggestions.get(id));
            }
        });
        return selected;
    }

    /**
     * Approved and edited suggestions carrying their effective text, ready for apply.
     */
    public synchronized List<Suggestion> resolvedForApply() {
        var resolved = new ArrayList<Suggestion>();
        for (Suggestion s : approvedOrEdited()) {
            resolved.add(s.withText(effectiveText(s.id())));
        }
        return resolved;
    }

    public synchronized List<Suggestion> suggestions() {
        return List.copyOf(suggestions.values());
    }

    public synchronized Map<Integer, ReviewState> states() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(states));
    }

    private void transition(int id, ReviewStatus status, String editedText) {
        if (states.containsKey(id)) {
            states.put(id, new ReviewState(status, editedText));
        }
    }
}
