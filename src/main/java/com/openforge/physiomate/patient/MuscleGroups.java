package com.openforge.physiomate.patient;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * The 17 muscle groups and the mesh-name patterns that place a mesh in a
 * group. Loaded from {@code muscle-groups.json} on the classpath.
 *
 * A mesh belongs to a group when its lower-cased name, with underscores read
 * as spaces, contains any of the group's patterns. A mesh may fall into
 * several groups or none.
 */
@Component
public class MuscleGroups {

    static final String RESOURCE = "muscle-groups.json";

    private final Map<String, List<String>> patterns;

    public MuscleGroups(ObjectMapper objectMapper) {
        this(load(objectMapper));
    }

    MuscleGroups(Map<String, List<String>> patterns) {
        this.patterns = Collections.unmodifiableMap(new LinkedHashMap<>(patterns));
    }

    private static Map<String, List<String>> load(ObjectMapper objectMapper) {
        try (InputStream in = new ClassPathResource(RESOURCE).getInputStream()) {
            return objectMapper.readValue(in, new TypeReference<LinkedHashMap<String, List<String>>>() {});
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load " + RESOURCE, e);
        }
    }

    /** Group names in declaration order. */
    public Set<String> names() {
        return patterns.keySet();
    }

    public boolean isKnown(String group) {
        return patterns.containsKey(group);
    }

    public boolean contains(String group, String meshId) {
        String normalized = normalize(meshId);
        return patterns.getOrDefault(group, List.of()).stream().anyMatch(normalized::contains);
    }

    /** Groups the mesh falls into, in declaration order. */
    public List<String> classify(String meshId) {
        return patterns.keySet().stream().filter(group -> contains(group, meshId)).toList();
    }

    /**
     * Buckets mesh ids by group, keeping declaration order and dropping
     * empty groups. Meshes matching no group are left out.
     */
    public Map<String, List<String>> group(List<String> meshIds) {
        Map<String, List<String>> grouped = new LinkedHashMap<>();
        for (String group : patterns.keySet()) {
            List<String> members = meshIds.stream().filter(id -> contains(group, id)).toList();
            if (!members.isEmpty()) grouped.put(group, members);
        }
        return grouped;
    }

    public List<String> ungrouped(List<String> meshIds) {
        return meshIds.stream().filter(id -> classify(id).isEmpty()).toList();
    }

    static String normalize(String meshId) {
        return meshId == null ? "" : meshId.toLowerCase(Locale.ROOT).replace('_', ' ');
    }
}
