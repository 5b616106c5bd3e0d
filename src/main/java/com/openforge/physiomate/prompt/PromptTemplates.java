package com.openforge.physiomate.prompt;

import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Static prompt texts, read once from {@code prompts/} on the classpath.
 */
@Component
public class PromptTemplates {

    static final String COORDINATOR = "prompts/system.md";
    static final String RESEARCH    = "prompts/research-system.md";
    static final String WORKOUT     = "prompts/workout-system.md";

    private final String coordinator;
    private final String research;
    private final String workout;

    public PromptTemplates() {
        this(read(COORDINATOR), read(RESEARCH), read(WORKOUT));
    }

    public PromptTemplates(String coordinator, String research) {
        this(coordinator, research, "");
    }

    public PromptTemplates(String coordinator, String research, String workout) {
        this.coordinator = coordinator;
        this.research    = research;
        this.workout     = workout;
    }

    /** Persona and rules of the conversational agent. */
    public String coordinator() {
        return coordinator;
    }

    /** Instructions of the research sub-agent. */
    public String research() {
        return research;
    }

    /** Workout plan template; {{name}} placeholders are filled per request. */
    public String workout() {
        return workout;
    }

    private static String read(String path) {
        try (InputStream in = new ClassPathResource(path).getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load prompt " + path, e);
        }
    }
}
