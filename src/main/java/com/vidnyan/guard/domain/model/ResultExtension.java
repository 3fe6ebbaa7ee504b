package com.vidnyan.guard.domain.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Validator-specific detail attached to a {@link ValidationResult}.
 * Serialized with a {@code kind} discriminator so callers can tell the shapes apart.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ProjectReport.class, name = "project"),
    @JsonSubTypes.Type(value = DependencyReport.class, name = "dependencies")
})
public interface ResultExtension {
}
