package io.proofproxy;

import io.proofproxy.cli.ProofProxyCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new ProofProxyCommand()).execute(args);
        System.exit(code);
    }
}
