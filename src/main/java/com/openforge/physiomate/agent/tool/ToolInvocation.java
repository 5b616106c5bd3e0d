package com.openforge.physiomate.agent.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Everything a callable receives for one call.
 *
 * @param toolCallId id the model assigned to the call
 * @param arguments  parsed arguments; never null, empty when the model sent none or garbage
 * @param substeps   progress side channel, {@link SubstepListener#NOOP} unless the tool emits substeps
 */
public record ToolInvocation(String toolCallId, ObjectNode arguments, SubstepListener substeps) {

    public String text(String field) {
        JsonNode node = arguments.get(field);
        if (node == null || node.isNull()) return "";
        return node.isTextual() ? node.asText() : node.toString();
    }

    public String requireText(String field) {
        String value = text(field).trim();
        if (value.isEmpty()) {
            throw new IllegalArgumentException("Missing required argument '" + field + "'");
        }
        return value;
    }

    public int intOr(String field, int defaultValue) {
        JsonNode node = arguments.get(field);
        if (node == null || !node.canConvertToInt() && !node.isTextual()) return defaultValue;
        return node.asInt(defaultValue);
    }
}
