package io.rtmmirror;

import io.rtmmirror.cli.RtmMirrorCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new RtmMirrorCommand()).execute(args);
        System.exit(code);
    }
}
