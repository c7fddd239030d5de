package com.docmend.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Docmend.
 * Routes to subcommands: suggest, files, backups, health, serve.
 */
@Command(
        name = "docmend",
        mixinStandardHelpOptions = true,
        version = "Docmend 0.1.0",
        description = "Suggest, review and apply documentation updates",
        subcommands = {
                SuggestCommand.class,
                FilesCommand.class,
                BackupsCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class DocmendCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
