package com.docmend.dispatch.cli;

import com.docmend.core.apply.ApplyEngine;
import com.docmend.core.model.ApplyOutcome;
import com.docmend.core.model.Suggestion;
import com.docmend.core.review.ReviewSession;
import com.docmend.core.suggest.InvalidInputException;
import com.docmend.core.suggest.SuggestionGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: docmend suggest "&lt;query&gt;" [--apply 1,3] [--apply-all]
 * <p>
 * Prints suggestions for the query. With {@code --apply} or {@code --apply-all}
 * the selected suggestions are approved and written to the corpus, with backups.
 */
@Command(name = "suggest", mixinStandardHelpOptions = true,
        description = "Suggest documentation edits for a query")
@Component
public class SuggestCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", description = "Natural language description of the change")
    private List<String> query;

    @Option(names = {"--apply", "-a"}, split = ",", description = "Suggestion ids to approve and apply")
    private List<Integer> applyIds;

    @Option(names = "--apply-all", description = "Approve and apply every suggestion")
    private boolean applyAll;

    private final SuggestionGenerator suggestionGenerator;
    private final ApplyEngine applyEngine;

    public SuggestCommand(SuggestionGenerator suggestionGenerator, ApplyEngine applyEngine) {
        this.suggestionGenerator = suggestionGenerator;
        this.applyEngine = applyEngine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<Suggestion> suggestions;
        try {
            suggestions = suggestionGenerator.generate(String.join(" ", query));
        } catch (InvalidInputException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        if (suggestions.isEmpty()) {
            ConsoleOutput.info("No matching documentation found.");
            return 0;
        }
        ConsoleOutput.info("Suggestions (" + suggestions.size() + "):");
        suggestions.forEach(ConsoleOutput::suggestion);

        boolean hasIds = applyIds != null && !applyIds.isEmpty();
        if (!applyAll && !hasIds) {
            return 0;
        }

        var review = new ReviewSession(suggestions);
        if (applyAll) {
            suggestions.forEach(s -> review.approve(s.id()));
        } else {
            applyIds.forEach(review::approve);
        }
        List<Suggestion> selected = review.resolvedForApply();
        if (selected.isEmpty()) {
            ConsoleOutput.error("None of the requested ids match a suggestion.");
            return 1;
        }

        System.out.println();
        ConsoleOutput.info("Applying " + selected.size() + " suggestion(s)...");
        ApplyOutcome outcome = applyEngine.apply(selected);
        ConsoleOutput.outcome(outcome);
        return outcome.errors().isEmpty() ? 0 : 1;
    }
}
