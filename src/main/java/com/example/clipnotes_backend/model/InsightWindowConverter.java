package com.example.clipnotes_backend.model;

import com.example.clipnotes_backend.service.insight.InsightWindow;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores windows by their short key ({@code 24h}, {@code 7d}).
 */
@Converter
public class InsightWindowConverter implements AttributeConverter<InsightWindow, String> {
    @Override
    public String convertToDatabaseColumn(InsightWindow window) {
        return window == null ? null : window.key();
    }

    @Override
    public InsightWindow convertToEntityAttribute(String key) {
        return key == null ? null : InsightWindow.validate(key);
    }
}
