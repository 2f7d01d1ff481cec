// file: cli/src/main/java/io/patternkit/cli/Cli.java
package io.patternkit.cli;

import io.patternkit.core.AccumulatorListener;
import io.patternkit.core.CommandHistory;
import io.patternkit.core.DivisionByZeroException;
import io.patternkit.core.RedoTailPolicy;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Drives a {@link CommandHistory} from the command line.
 *
 * Usage:
 *   patternkit-cli [--redo-tail discard|retain] [--script file.json] [step ...]
 *
 * Examples:
 *   patternkit-cli compute + 100 compute - 50 compute '*' 10 compute / 2 undo 4 redo 3
 *   patternkit-cli --redo-tail retain --script session.json value
 *
 * Every applied operation is logged; the final value is printed to stdout.
 */
public final class Cli {
    private static final Logger log = Logger.getLogger(Cli.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILURE = 2;

    private Cli() {
        // no-op
    }

    public static void main(String[] args) {
        configureLogging();
        int code = run(args, System.out, System.err);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    /**
     * Parse {@code args}, run all steps and print the resulting value.
     *
     * @return process exit code
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            CliConfig cfg = CliConfig.fromArgs(args);
            if (cfg.help()) {
                out.print(USAGE);
                return EXIT_OK;
            }

            List<Step> steps = new ArrayList<>();
            RedoTailPolicy policy = cfg.redoTailPolicy();
            if (cfg.scriptPath() != null) {
                Script script = Script.fromJsonFile(Path.of(cfg.scriptPath()));
                steps.addAll(script.steps());
                if (policy == null) {
                    policy = script.redoTailPolicy();
                }
            }
            steps.addAll(cfg.steps());
            if (steps.isEmpty()) {
                throw new CliException("no steps given");
            }
            if (policy == null) {
                policy = RedoTailPolicy.DISCARD;
            }

            var history = new CommandHistory(policy, AccumulatorListener.logging());
            for (Step step : steps) {
                step.applyTo(history, out);
            }
            out.println(history.value());
            return EXIT_OK;
        } catch (CliException e) {
            err.println("error: " + e.getMessage());
            err.print(USAGE);
            return EXIT_USAGE;
        } catch (DivisionByZeroException e) {
            log.log(Level.FINE, "step failed", e);
            err.println("error: division by zero");
            return EXIT_USAGE;
        } catch (RuntimeException e) {
            e.printStackTrace(err);
            return EXIT_FAILURE;
        }
    }

    private static void configureLogging() {
        try (InputStream in = Cli.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            log.log(Level.WARNING, "Failed to load logging.properties, using JVM defaults", e);
        }
    }

    private static final String USAGE = """
            Usage:
              patternkit-cli [--redo-tail discard|retain] [--script file.json] [step ...]

            Steps:
              compute <op> <operand>   op is one of + - * / (or plus, minus, asterisk, slash)
              undo <levels>            undo up to <levels> commands
              redo <levels>            redo up to <levels> commands
              value                    print the current value

            Options:
              --redo-tail, -t   what a new compute does with undone commands (default: discard)
              --script,    -s   JSON script whose steps run before the inline ones
              --help,      -h   show this help message
            """;
}
