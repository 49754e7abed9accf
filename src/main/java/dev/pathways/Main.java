package dev.pathways;

import dev.pathways.cli.PathwaysCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new PathwaysCli()).execute(args);
        System.exit(exitCode);
    }
}
