package io.snapbridge;

import io.snapbridge.cli.SnapBridgeCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new SnapBridgeCommand()).execute(args);
        System.exit(code);
    }
}
