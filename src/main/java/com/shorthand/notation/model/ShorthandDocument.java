package com.shorthand.notation.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Represents one fully parsed shorthand source file.
 *
 * Read-only once built: every list is immutable and nothing downstream of the
 * parser modifies a document.
 */
@Value
@Builder
public class ShorthandDocument {
    @NonNull
    Metadata metadata;

    /** State variables written outside any entity. */
    @Singular("moduleStateVariable")
    List<StateVariable> moduleState;

    @Singular
    List<EntityNode> entities;

    @Singular
    List<FunctionNode> functions;

    @Singular
    List<Diagnostic> diagnostics;

    public Optional<EntityNode> findEntity(String name) {
        return entities.stream()
                .filter(e -> e.getName().equals(name))
                .findFirst();
    }

    public Optional<FunctionNode> findFunction(String name) {
        return functions.stream()
                .filter(f -> f.getName().equals(name))
                .findFirst();
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.getSeverity() == Severity.ERROR);
    }

    public List<Diagnostic> getWarnings() {
        return diagnostics.stream()
                .filter(d -> d.getSeverity() == Severity.WARNING)
                .toList();
    }

    /**
     * Compares everything except diagnostics and source positions, so two
     * layouts of the same structure compare equal.
     */
    public boolean structurallyEquals(ShorthandDocument other) {
        return other != null
                && Objects.equals(metadata, other.metadata)
                && Objects.equals(moduleState, other.moduleState)
                && Objects.equals(entities, other.entities)
                && Objects.equals(functions, other.functions);
    }
}
