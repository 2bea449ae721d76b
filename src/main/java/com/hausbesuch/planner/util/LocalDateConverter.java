package com.hausbesuch.planner.util;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Stores calendar dates as ISO {@code yyyy-MM-dd} text. A timestamp in the column is cut down
 * to its date; unreadable values are read as {@code null}.
 */
@Converter(autoApply = true)
public class LocalDateConverter implements AttributeConverter<LocalDate, String> {

    private static final Logger LOGGER = LoggerFactory.getLogger(LocalDateConverter.class);

    @Override
    public String convertToDatabaseColumn(LocalDate localDate) {
        return localDate != null ? localDate.toString() : null;
    }

    @Override
    public LocalDate convertToEntityAttribute(String dbData) {
        try {
            return parse(dbData);
        } catch (DateTimeParseException e) {
            LOGGER.warn("Unreadable date '{}' in database: {}", dbData, e.getMessage());
            return null;
        }
    }

    /**
     * Reads stored date text. Blank input gives {@code null}; a timestamp is cut down to its date.
     *
     * @throws DateTimeParseException if the text is not a valid calendar date
     */
    public static LocalDate parse(String text) {
        if (text == null || text.trim().isEmpty()) {
            return null;
        }
        String value = text.trim();
        if (value.length() > 10) {
            value = value.substring(0, 10);
        }
        return LocalDate.parse(value);
    }
}
