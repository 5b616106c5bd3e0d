package com.openforge.physiomate.agent;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * An ACTION tool call forwarded to the client instead of being executed.
 * Holds its own copy of the parameters and hands out copies.
 */
public record ActionRecord(String name, ObjectNode params) {

    public ActionRecord {
        params = params == null ? JsonNodeFactory.instance.objectNode() : params.deepCopy();
    }

    @Override
    public ObjectNode params() {
        return params.deepCopy();
    }
}
