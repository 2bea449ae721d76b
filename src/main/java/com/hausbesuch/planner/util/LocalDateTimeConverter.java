package com.hausbesuch.planner.util;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Stores timestamps as {@code yyyy-MM-dd HH:mm:ss} text. Rows written by other tools in ISO
 * form (with {@code T} separator, fractions or an offset) are read as well; anything else is
 * read as {@code null} so the record surfaces as a data quality issue instead of failing the
 * whole query.
 */
@Converter(autoApply = true)
public class LocalDateTimeConverter implements AttributeConverter<LocalDateTime, String> {

    private static final Logger LOGGER = LoggerFactory.getLogger(LocalDateTimeConverter.class);
    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    @Override
    public String convertToDatabaseColumn(LocalDateTime localDateTime) {
        if (localDateTime == null) {
            return null;
        }
        return localDateTime.withNano(0).format(FORMATTER);
    }

    @Override
    public LocalDateTime convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.trim().isEmpty()) {
            return null;
        }
        String value = dbData.trim();
        try {
            return LocalDateTime.parse(value, FORMATTER);
        } catch (DateTimeParseException e) {
            String cleaned = value.replace(' ', 'T');
            int offsetIndex = offsetIndex(cleaned);
            if (offsetIndex > 0) {
                cleaned = cleaned.substring(0, offsetIndex);
            }
            try {
                return LocalDateTime.parse(cleaned);
            } catch (DateTimeParseException e2) {
                LOGGER.warn("Unreadable timestamp '{}' in database: {}", dbData, e2.getMessage());
                return null;
            }
        }
    }

    private int offsetIndex(String value) {
        int index = value.indexOf('Z');
        if (index < 0) {
            index = value.indexOf('+');
        }
        if (index < 0 && value.length() > 10) {
            // skip the date part when looking for a negative offset
            index = value.indexOf('-', 10);
        }
        return index;
    }
}
