package io.taskvault;

import io.taskvault.cli.TaskVaultCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new TaskVaultCommand()).execute(args);
        System.exit(code);
    }
}
