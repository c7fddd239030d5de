package com.docmend.dispatch.cli;

import com.docmend.core.corpus.CorpusIndex;
import com.docmend.core.model.DocumentFile;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: docmend files
 * <p>
 * Lists the documents in the corpus with their line and section counts.
 */
@Command(name = "files", mixinStandardHelpOptions = true, description = "List documentation files")
@Component
public class FilesCommand implements Runnable {

    private final CorpusIndex corpusIndex;

    public FilesCommand(CorpusIndex corpusIndex) {
        this.corpusIndex = corpusIndex;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<DocumentFile> files = corpusIndex.listFiles();
        if (files.isEmpty()) {
            ConsoleOutput.info("No documentation files under " + corpusIndex.root());
            return;
        }

        ConsoleOutput.info(files.size() + " file(s) under " + corpusIndex.root() + ":");
        System.out.println();
        System.out.printf("  %-48s %7s %9s%n", "PATH", "LINES", "SECTIONS");
        System.out.println("  " + "-".repeat(66));
        for (DocumentFile file : files) {
            System.out.printf("  %-48s %7d %9d%n", file.path(), file.lineCount(), file.sections().size());
        }
    }
}
