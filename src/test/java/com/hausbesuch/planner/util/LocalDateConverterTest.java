package com.hausbesuch.planner.util;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

import static org.junit.jupiter.api.Assertions.*;

class LocalDateConverterTest {

    private final LocalDateConverter converter = new LocalDateConverter();

    @Test
    void readsIsoDatesAndTimestampPrefixes() {
        assertEquals(LocalDate.of(2024, 3, 1), converter.convertToEntityAttribute("2024-03-01"));
        assertEquals(LocalDate.of(2024, 3, 1), converter.convertToEntityAttribute("2024-03-01 09:30:00"));
        assertEquals("2024-03-01", converter.convertToDatabaseColumn(LocalDate.of(2024, 3, 1)));
    }

    @Test
    void impossibleDateIsReadAsNullButParseFails() {
        assertNull(converter.convertToEntityAttribute("2024-02-30"));
        assertThrows(DateTimeParseException.class, () -> LocalDateConverter.parse("2024-02-30"));
        assertNull(LocalDateConverter.parse("  "));
    }
}
