package com.scriptdeck.runner.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Request body for POST /run.
 *
 * Required: script (file name in the scripts directory)
 * Optional: args, inputVars (lines written to the script's stdin)
 */
public record RunScriptRequest(String script,
                               List<String> args,
                               @JsonAlias("input_vars") JsonNode inputVars) {

    public List<String> inputs() {
        return InputValues.coerce(inputVars);
    }
}
