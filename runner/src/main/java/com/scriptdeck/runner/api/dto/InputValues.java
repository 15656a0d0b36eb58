package com.scriptdeck.runner.api.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the loosely typed {@code inputVars} field into the lines fed to a script.
 *
 * Anything other than a JSON array counts as "no input". Strings are used as is;
 * numbers, booleans, null and nested values become their JSON text.
 */
public final class InputValues {

    private InputValues() {}

    public static List<String> coerce(JsonNode node) {
        if (node == null || !node.isArray()) return List.of();
        List<String> values = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            values.add(element.isTextual() ? element.asText() : element.toString());
        }
        return values;
    }
}
