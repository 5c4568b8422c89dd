package com.enterprise.softdelete.domain.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Persists a set of entity IDs as a JSON array column.
 */
@Converter
public class EntityIdSetConverter implements AttributeConverter<Set<UUID>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final TypeReference<LinkedHashSet<UUID>> ID_SET = new TypeReference<>() { };

    @Override
    public String convertToDatabaseColumn(Set<UUID> ids) {
        if (ids == null || ids.isEmpty()) {
            return "[]";
        }
        try {
            return MAPPER.writeValueAsString(ids);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize failed entity IDs", e);
        }
    }

    @Override
    public Set<UUID> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashSet<>();
        }
        try {
            return MAPPER.readValue(json, ID_SET);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to read failed entity IDs", e);
        }
    }
}
