package com.scriptdeck.runner.catalog;

public class ScriptNotFoundException extends RuntimeException {
    public ScriptNotFoundException(String message) {
        super(message);
    }
}
