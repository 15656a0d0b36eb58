package com.scriptdeck.runner.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Request body for POST /run_repo.
 *
 * Required: repoId, path (relative to the repository root)
 * Optional: args, inputVars
 */
public record RunRepoRequest(@JsonAlias("repo_id") String repoId,
                             String path,
                             List<String> args,
                             @JsonAlias("input_vars") JsonNode inputVars) {

    public List<String> inputs() {
        return InputValues.coerce(inputVars);
    }
}
