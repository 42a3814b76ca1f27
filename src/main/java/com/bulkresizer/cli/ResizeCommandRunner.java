package com.bulkresizer.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

/**
 * Hands the raw program arguments to picocli once the context is up and keeps
 * the exit code for {@code SpringApplication.exit}.
 */
@Component
public class ResizeCommandRunner implements CommandLineRunner, ExitCodeGenerator {

    private final ResizeCommand resizeCommand;
    private int exitCode;

    public ResizeCommandRunner(ResizeCommand resizeCommand) {
        this.resizeCommand = resizeCommand;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(resizeCommand).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
