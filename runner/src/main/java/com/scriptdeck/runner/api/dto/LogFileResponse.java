package com.scriptdeck.runner.api.dto;

/** Response body for GET /download/{jobId}: where the transcript lives on the server. */
public record LogFileResponse(String logFile) {}
