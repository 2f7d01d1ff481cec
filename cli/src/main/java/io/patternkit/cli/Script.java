// file: cli/src/main/java/io/patternkit/cli/Script.java
package io.patternkit.cli;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.patternkit.cli.dto.JsonScript;
import io.patternkit.cli.dto.JsonStep;
import io.patternkit.core.RedoTailPolicy;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Steps (and optionally a redo-tail policy) loaded from a JSON script file.
 *
 * @param redoTailPolicy policy requested by the script, or null if it names none
 * @param steps          steps in file order
 */
record Script(RedoTailPolicy redoTailPolicy, List<Step> steps) {

    Script {
        steps = List.copyOf(steps);
    }

    static Script fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true)
                // Operands and levels are integers; reject 1.5 instead of truncating it.
                .configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, false);
        JsonScript json;
        try {
            json = mapper.readValue(path.toFile(), JsonScript.class);
        } catch (IOException e) {
            throw new CliException("failed to read script " + path + ": " + e.getMessage(), e);
        }
        if (json == null) {
            throw new CliException("empty script: " + path);
        }

        List<Step> steps = new ArrayList<>();
        if (json.steps != null) {
            for (int i = 0; i < json.steps.size(); i++) {
                steps.add(toStep(json.steps.get(i), i));
            }
        }
        RedoTailPolicy policy = json.redoTail == null ? null : CliConfig.parsePolicy(json.redoTail);
        return new Script(policy, steps);
    }

    private static Step toStep(JsonStep s, int index) {
        if (s == null || s.action == null) {
            throw new CliException("step " + index + ": missing action");
        }
        return switch (s.action.toLowerCase(Locale.ROOT)) {
            case "compute" -> {
                if (s.operator == null || s.operand == null) {
                    throw new CliException("step " + index + ": compute requires operator and operand");
                }
                yield Step.compute(s.operator, String.valueOf(s.operand));
            }
            case "undo", "redo" -> {
                if (s.levels == null) {
                    throw new CliException("step " + index + ": " + s.action + " requires levels");
                }
                yield Step.move(s.action, String.valueOf(s.levels));
            }
            case "value" -> new Step.Value();
            default -> throw new CliException("step " + index + ": unknown action " + s.action);
        };
    }
}
