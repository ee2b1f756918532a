package com.tradescan.backend.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradescan.backend.model.params.ProfileParameters;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class ProfileParametersConverter implements AttributeConverter<ProfileParameters, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Override
    public String convertToDatabaseColumn(ProfileParameters attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return MAPPER.writerFor(ProfileParameters.class).writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize profile parameters", e);
        }
    }

    @Override
    public ProfileParameters convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(dbData, ProfileParameters.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored profile parameters are unreadable", e);
        }
    }
}
