package com.astralcore.security.phi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Which fields of each entity type hold PHI and are therefore stored encrypted.
 */
public final class PhiFieldPolicy {

    private final Map<String, Set<String>> fieldsByEntity;

    private PhiFieldPolicy(Map<String, Set<String>> fieldsByEntity) {
        this.fieldsByEntity = fieldsByEntity;
    }

    public static PhiFieldPolicy defaults() {
        Map<String, Set<String>> fields = new LinkedHashMap<>();
        fields.put("User", ordered("email", "phoneNumber"));
        fields.put("Profile", ordered("firstName", "lastName", "dateOfBirth", "phoneNumber", "address"));
        fields.put("ClientProfile", ordered("primaryConcerns", "goals"));
        fields.put("SessionNote", ordered("presentingIssues", "interventions", "clientResponse", "homework",
                "additionalNotes"));
        fields.put("WellnessData", ordered("notes", "symptoms", "triggers"));
        fields.put("JournalEntry", ordered("content", "title"));
        fields.put("CrisisIntervention", ordered("triggerEvent", "symptoms", "responderNotes", "outcome"));
        fields.put("Message", ordered("content", "subject"));
        return new PhiFieldPolicy(Map.copyOf(fields));
    }

    public static PhiFieldPolicy empty() {
        return new PhiFieldPolicy(Map.of());
    }

    /**
     * A copy of this policy with {@code entityType} protecting exactly {@code fields}.
     */
    public PhiFieldPolicy with(String entityType, String... fields) {
        if (entityType == null || entityType.isBlank()) {
            throw new IllegalArgumentException("entityType must not be null or blank");
        }
        Map<String, Set<String>> copy = new LinkedHashMap<>(fieldsByEntity);
        copy.put(entityType, ordered(fields));
        return new PhiFieldPolicy(Map.copyOf(copy));
    }

    public Set<String> fieldsFor(String entityType) {
        return fieldsByEntity.getOrDefault(entityType, Set.of());
    }

    public boolean isPhi(String entityType, String field) {
        return fieldsFor(entityType).contains(field);
    }

    public Set<String> entityTypes() {
        return fieldsByEntity.keySet();
    }

    private static Set<String> ordered(String... fields) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(List.of(fields)));
    }
}
