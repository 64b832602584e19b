package com.unifiedcalendar.backend.entry.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores the source variant as JSON, discriminated by its {@code type} field.
 */
@Converter
public class EntrySourceConverter implements AttributeConverter<EntrySource, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Override
    public String convertToDatabaseColumn(EntrySource source) {
        if (source == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(source);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize entry source: " + e.getMessage(), e);
        }
    }

    @Override
    public EntrySource convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(json, EntrySource.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot read entry source: " + e.getMessage(), e);
        }
    }
}
