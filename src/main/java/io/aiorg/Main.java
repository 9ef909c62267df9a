package io.aiorg;

import io.aiorg.cli.AiorgCommand;
import io.aiorg.error.AiorgException;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        CommandLine cli = new CommandLine(new AiorgCommand());
        cli.setExecutionExceptionHandler((e, commandLine, parseResult) -> {
            if (e instanceof AiorgException) {
                commandLine.getErr().println("Error: " + e.getMessage());
                return 1;
            }
            throw e;
        });
        int code = cli.execute(args);
        System.exit(code);
    }
}
