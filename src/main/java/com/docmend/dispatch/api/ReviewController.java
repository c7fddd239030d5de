package com.docmend.dispatch.api;

import com.docmend.core.apply.ApplyEngine;
import com.docmend.core.logging.MdcContext;
import com.docmend.core.model.ApplyOutcome;
import com.docmend.core.model.Suggestion;
import com.docmend.core.review.ReviewSession;
import com.docmend.core.review.ReviewSessionRegistry;
import com.docmend.core.suggest.InvalidInputException;
import com.docmend.core.suggest.SuggestionGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * REST controller for server-held review sessions: generate, decide per
 * suggestion, then apply once.
 */
@RestController
@RequestMapping("/api/v1/reviews")
public class ReviewController {

    private static final Logger log = LoggerFactory.getLogger(ReviewController.class);

    private final SuggestionGenerator suggestionGenerator;
    private final ReviewSessionRegistry registry;
    private final ApplyEngine applyEngine;

    public ReviewController(SuggestionGenerator suggestionGenerator,
                            ReviewSessionRegistry registry,
                            ApplyEngine applyEngine) {
        this.suggestionGenerator = suggestionGenerator;
        this.registry = registry;
        this.applyEngine = applyEngine;
    }

    /**
     * POST /api/v1/reviews — Generate suggestions and open a review over them.
     */
    @PostMapping
    public ResponseEntity<?> open(@RequestBody SuggestRequest request) {
        List<Suggestion> suggestions;
        try {
            suggestions = suggestionGenerator.generate(request.query());
        } catch (InvalidInputException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Suggestion generation failed", e);
            return DocUpdateController.internalError("Error generating suggestions", e);
        }
        String reviewId = registry.open(suggestions);
        ReviewSession session = registry.find(reviewId).orElseThrow();
        return ResponseEntity.status(HttpStatus.CREATED).body(ReviewResponse.of(reviewId, session));
    }

    /**
     * GET /api/v1/reviews/{id} — Current decisions for every suggestion.
     */
    @GetMapping("/{id}")
    public ResponseEntity<ReviewResponse> get(@PathVariable String id) {
        return registry.find(id)
                .map(session -> ResponseEntity.ok(ReviewResponse.of(id, session)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * POST /api/v1/reviews/{id}/suggestions/{suggestionId} — Record a decision.
     * Unknown suggestion ids are ignored.
     */
    @PostMapping("/{id}/suggestions/{suggestionId}")
    public ResponseEntity<?> decide(@PathVariable String id,
                                    @PathVariable int suggestionId,
                                    @RequestBody ReviewActionRequest request) {
        var found = registry.find(id);
        if (found.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        ReviewSession session = found.get();
        String action = request.action() == null ? "" : request.action().toLowerCase(Locale.ROOT);
        switch (action) {
            case "approve" -> session.approve(suggestionId);
            case "reject" -> session.reject(suggestionId);
            case "edit" -> {
                session.edit(suggestionId);
                if (request.text() != null) {
                    session.setEditedText(suggestionId, request.text());
                }
            }
            default -> {
                return ResponseEntity.badRequest().body(
                        Map.of("error", "Invalid action: " + request.action()
                                + ". Valid actions: approve, reject, edit"));
            }
        }
        return ResponseEntity.ok(ReviewResponse.of(id, session));
    }

    /**
     * POST /api/v1/reviews/{id}/apply — Close the review and apply its approved
     * and edited suggestions.
     */
    @PostMapping("/{id}/apply")
    public ResponseEntity<?> apply(@PathVariable String id) {
        // take() removes the review, so a concurrent second apply gets 404
        var taken = registry.take(id);
        if (taken.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        MdcContext.setReview(id);
        try {
            ApplyOutcome outcome = applyEngine.apply(taken.get().resolvedForApply());
            return ResponseEntity.ok(outcome);
        } catch (Exception e) {
            log.error("Apply for review {} failed", id, e);
            return DocUpdateController.internalError("Error applying updates", e);
        }
    }

    /**
     * DELETE /api/v1/reviews/{id} — Abandon a review without applying.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> discard(@PathVariable String id) {
        return registry.discard(id)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }
}
