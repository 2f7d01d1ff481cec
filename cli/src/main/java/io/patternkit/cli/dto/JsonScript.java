package io.patternkit.cli.dto;

import java.util.List;

/**
 * JSON shape of a CLI script:
 * <pre>
 * {"redoTail": "retain", "steps": [{"action": "compute", "operator": "+", "operand": 100},
 *                                  {"action": "undo", "levels": 1}]}
 * </pre>
 */
public class JsonScript {
    public String redoTail;
    public List<JsonStep> steps;
}
