package com.docmend.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final DocmendCommand docmendCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(DocmendCommand docmendCommand, IFactory factory) {
        this.docmendCommand = docmendCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        // In serve mode the embedded web server owns the JVM; picocli would
        // return immediately and let main() finish.
        if (isServeMode(args)) {
            return;
        }
        exitCode = new CommandLine(docmendCommand, factory).execute(args);
    }

    /**
     * Only a leading {@code serve} selects server mode. Later words may be part of a
     * free-text query such as {@code suggest update serve docs}.
     */
    public static boolean isServeMode(String... args) {
        return args != null && args.length > 0 && "serve".equals(args[0]);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
