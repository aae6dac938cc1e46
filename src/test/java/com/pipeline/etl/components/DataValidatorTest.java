package com.pipeline.etl.components;

import com.pipeline.etl.exception.ConfigurationException;
import com.pipeline.etl.model.Dataset;
import org.junit.jupiter.api.Test;

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class DataValidatorTest {

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    private static Map<String, Object> rule(Object... keyValues) {
        return row(keyValues);
    }

    private static Dataset contacts() {
        return Dataset.fromRows(List.of(
                row("id", 1, "email", "a@x.io", "phone", "555-123-4567", "status", "active",
                        "code", "AB12", "joined", "2024-02-28", "score", 50),
                row("id", 2, "email", "bad", "phone", "12345", "status", "gone",
                        "code", "A", "joined", "2024-02-30", "score", 150),
                row("id", 2, "email", null, "phone", "+1 (555) 987-6543", "status", "active",
                        "code", "ABCDEFG", "joined", null, "score", null)));
    }

    @Test
    void testTransform_nonStrictKeepsRowsAndAnnotatesErrors() {
        DataValidator validator = new DataValidator("validator", false, List.of(
                rule("type", "email_format", "column", "email", "error_message", "bad email"),
                rule("type", "date_format", "column", "joined"),
                rule("type", "unique", "column", "id", "error_message", "dup id")));

        Dataset result = validator.transform(contacts());

        assertEquals(3, result.size());
        assertEquals("", result.getValue(0, DataValidator.ERROR_COLUMN));
        assertEquals("bad email; Validation failed: date_format; dup id; ",
                result.getValue(1, DataValidator.ERROR_COLUMN));
        assertEquals("bad email; dup id; ", result.getValue(2, DataValidator.ERROR_COLUMN),
                "Null email fails the format check, null date is skipped");
        assertEquals(List.of("Found 2 rows with validation errors"), validator.drainWarnings());
        assertTrue(validator.drainWarnings().isEmpty());
    }

    @Test
    void testTransform_strictModeDropsInvalidRows() {
        DataValidator validator = new DataValidator("validator", true, List.of(
                rule("type", "phone_format", "column", "phone"),
                rule("type", "in_list", "column", "status", "values", List.of("active", "pending"))));

        Dataset input = contacts();
        Dataset result = validator.transform(input);

        assertEquals(2, result.size());
        assertEquals(Arrays.asList("555-123-4567", "+1 (555) 987-6543"), result.getColumnValues("phone"));
        assertFalse(result.hasColumn(DataValidator.ERROR_COLUMN));
        assertEquals(3, input.size(), "Input dataset must not be modified");
        assertTrue(validator.drainWarnings().get(0).contains("removed in strict mode"));
    }

    @Test
    void testTransform_lengthAndRangeSkipNulls() {
        DataValidator validator = new DataValidator("validator", true, List.of(
                rule("type", "length", "column", "code", "min_length", 2, "max_length", 6),
                rule("type", "range", "column", "score", "min", 0, "max", 100)));

        Dataset result = validator.transform(contacts());

        assertEquals(List.of(1), result.getColumnValues("id"));
    }

    @Test
    void testTransform_allRowsValidLeavesNoErrorColumn() {
        DataValidator validator = new DataValidator("validator", false, List.of(
                rule("type", "pattern", "column", "code", "pattern", "[A-Z]+\\d*"),
                rule("type", "range", "column", "score", "max", 200),
                rule("type", "not_null", "column", "phone")));

        Dataset result = validator.transform(contacts());

        assertEquals(3, result.size());
        assertEquals(contacts().getColumns(), result.getColumns());
        assertTrue(validator.drainWarnings().isEmpty());
    }

    @Test
    void testToFormatter_translatesStrftimeDirectives() {
        DateTimeFormatter formatter = DataValidator.toFormatter("%d/%m/%Y %H:%M", "test");

        assertDoesNotThrow(() -> formatter.parse("28/02/2024 13:05"));
        assertThrows(DateTimeParseException.class, () -> formatter.parse("2024-02-28 13:05"));
        assertThrows(DateTimeParseException.class, () -> formatter.parse("30/02/2024 13:05"));
    }

    @Test
    void testConstruct_invalidRulesRejected() {
        assertThrows(ConfigurationException.class, () -> new DataValidator("v", false,
                List.of(rule("type", "checksum", "column", "id"))));
        assertThrows(ConfigurationException.class, () -> new DataValidator("v", false,
                List.of(rule("type", "not_null"))));
        assertThrows(ConfigurationException.class, () -> new DataValidator("v", false,
                List.of(rule("type", "pattern", "column", "code", "pattern", "["))));
        assertThrows(ConfigurationException.class, () -> new DataValidator("v", false,
                List.of(rule("type", "range", "column", "score"))));
        assertThrows(ConfigurationException.class, () -> new DataValidator("v", false,
                List.of(rule("type", "in_list", "column", "status", "values", "active"))));
        assertThrows(ConfigurationException.class, () -> new DataValidator("v", false,
                List.of(rule("type", "date_format", "column", "joined", "format", "%Y-%j"))));
    }

    @Test
    void testTransform_unknownColumnFails() {
        DataValidator validator = new DataValidator("validator", false,
                List.of(rule("type", "not_null", "column", "fax")));

        assertThrows(IllegalArgumentException.class, () -> validator.transform(contacts()));
    }
}
