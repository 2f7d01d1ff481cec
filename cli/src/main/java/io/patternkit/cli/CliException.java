package io.patternkit.cli;

/** Bad command line or script: reported to the user with usage, exit code 1. */
final class CliException extends RuntimeException {
    CliException(String msg) {
        super(msg);
    }

    CliException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
