package com.scriptdeck.runner.api.dto;

/** Response body for POST /run and POST /run_repo. */
public record RunResponse(String jobId) {}
