package com.scriptdeck.runner.api.dto;

import java.util.List;

/** Response body for GET /repo_files/{repoId}. */
public record RepoFilesResponse(String repoId, List<String> files) {}
