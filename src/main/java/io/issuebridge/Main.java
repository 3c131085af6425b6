package io.issuebridge;

import io.issuebridge.cli.IssueBridgeCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new IssueBridgeCommand()).execute(args);
        System.exit(code);
    }
}
