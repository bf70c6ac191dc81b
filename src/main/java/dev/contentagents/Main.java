package dev.contentagents;

import dev.contentagents.cli.ContentAgentsCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new ContentAgentsCli()).execute(args);
        System.exit(exitCode);
    }
}
