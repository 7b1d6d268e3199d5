package io.shotrelay;

import io.shotrelay.cli.ShotRelayCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new ShotRelayCommand()).execute(args);
        System.exit(code);
    }
}
