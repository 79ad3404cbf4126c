package io.bundlemesh;

import io.bundlemesh.cli.BundleMeshCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new BundleMeshCommand()).execute(args);
        System.exit(code);
    }
}
