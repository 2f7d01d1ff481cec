// file: cli/src/main/java/io/patternkit/cli/CliConfig.java
package io.patternkit.cli;

import io.patternkit.core.RedoTailPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Command line parsed into options and inline steps.
 *
 * Supports:
 *  - redoTailPolicy: explicit --redo-tail choice, or null to defer to the script / default
 *  - scriptPath:     optional JSON script run before the inline steps
 *  - steps:          inline steps, in order
 *  - help:           --help was given
 */
record CliConfig(
        RedoTailPolicy redoTailPolicy,
        String scriptPath,
        List<Step> steps,
        boolean help
) {

    CliConfig {
        steps = List.copyOf(steps);
    }

    /**
     * Supported flags:
     *   --redo-tail, -t  discard|retain
     *   --script,    -s  <file.json>
     *   --help,      -h
     *
     * Steps:
     *   compute <op> <operand>
     *   undo <levels>
     *   redo <levels>
     *   value
     */
    static CliConfig fromArgs(String[] args) {
        RedoTailPolicy policy = null;
        String script = null;
        boolean help = false;
        List<Step> steps = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> help = true;

                case "--redo-tail", "-t" -> {
                    ensureValues(args, i, 1);
                    policy = parsePolicy(args[++i]);
                }

                case "--script", "-s" -> {
                    ensureValues(args, i, 1);
                    script = args[++i];
                }

                case "compute" -> {
                    ensureValues(args, i, 2);
                    steps.add(Step.compute(args[i + 1], args[i + 2]));
                    i += 2;
                }

                case "undo", "redo" -> {
                    ensureValues(args, i, 1);
                    steps.add(Step.move(args[i], args[++i]));
                }

                case "value" -> steps.add(new Step.Value());

                default -> throw new CliException("unknown argument: " + args[i]);
            }
        }
        return new CliConfig(policy, script, steps, help);
    }

    /** Parse "discard" / "retain" (any case) into a policy. */
    static RedoTailPolicy parsePolicy(String text) {
        try {
            return RedoTailPolicy.valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new CliException("unknown redo-tail policy: " + text + " (expected discard or retain)");
        }
    }

    private static void ensureValues(String[] args, int i, int count) {
        if (i + count >= args.length) {
            throw new CliException("missing value for " + args[i]);
        }
    }
}
