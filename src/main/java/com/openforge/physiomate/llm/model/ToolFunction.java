package com.openforge.physiomate.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The "function" sub-object inside a Tool declaration.
 *
 * "parameters" is kept as a JsonNode so the JSON Schema written in the
 * tool catalog goes out verbatim, with no intermediate POJO mapping.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolFunction(
        String name,
        String description,
        JsonNode parameters
) {}
