package com.logpipeline.common;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Process roles selected by the first command-line argument.
 */
public enum PipelineRole {
    READER("reader", "Read log files and push to queue"),
    PROCESSOR("processor", "Consume from queue and index to database"),
    INIT_DB("init-db", "Initialize database schema");

    private final String cliName;
    private final String description;

    PipelineRole(String cliName, String description) {
        this.cliName = cliName;
        this.description = description;
    }

    public String cliName() {
        return cliName;
    }

    public String description() {
        return description;
    }

    public static Optional<PipelineRole> fromCliName(String name) {
        return Arrays.stream(values())
            .filter(role -> role.cliName.equals(name))
            .findFirst();
    }

    /**
     * Resolves the role from the first non-option argument. Spring style
     * {@code --key=value} arguments are skipped.
     */
    public static Optional<PipelineRole> fromArgs(List<String> args) {
        return args.stream()
            .filter(arg -> !arg.startsWith("--"))
            .findFirst()
            .flatMap(PipelineRole::fromCliName);
    }

    public static Optional<PipelineRole> fromArgs(String[] args) {
        return fromArgs(args == null ? List.of() : Arrays.asList(args));
    }

    public static void printUsage(PrintStream out, String command, List<PipelineRole> roles) {
        out.println("Usage: " + command + " <role>");
        out.println();
        out.println("Roles:");
        for (PipelineRole role : roles) {
            out.printf("  %-11s %s%n", role.cliName, role.description);
        }
    }
}
