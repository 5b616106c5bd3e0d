package com.openforge.physiomate.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * One earlier message of the visible conversation.
 *
 * @param role    "user" or "assistant"
 * @param content message text
 */
public record HistoryMessage(

        @NotNull
        @Pattern(regexp = "user|assistant", message = "role must be 'user' or 'assistant'")
        String role,

        @NotNull
        String content
) {}
