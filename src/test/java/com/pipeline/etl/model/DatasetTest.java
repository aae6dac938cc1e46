package com.pipeline.etl.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DatasetTest {

    private Dataset members;

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    @BeforeEach
    void setUp() {
        members = Dataset.fromRows(List.of(
                row("id", 1, "name", "Ann"),
                row("id", 2, "name", null)));
    }

    @Test
    void testGetRows_rowViewsAreReadOnly() {
        Map<String, Object> first = members.getRows().get(0);

        assertThrows(UnsupportedOperationException.class, () -> first.put("name", "Eve"));
        assertThrows(UnsupportedOperationException.class, () -> first.remove("id"));
        assertThrows(UnsupportedOperationException.class, () -> members.getRows().clear());
        assertEquals("Ann", members.getValue(0, "name"));
        assertEquals(2, members.size());
    }

    @Test
    void testGetRows_reflectsLaterSetValue() {
        Map<String, Object> second = members.getRows().get(1);

        members.setValue(1, "name", "Bo");

        assertEquals("Bo", second.get("name"));
    }

    @Test
    void testCopy_isIndependentOfSource() {
        Dataset copy = members.copy();
        copy.setValue(0, "name", "Eve");

        assertEquals("Ann", members.getValue(0, "name"));
        assertEquals("Eve", copy.getValue(0, "name"));
    }

    @Test
    void testWithColumn_appendsOrKeepsPosition() {
        Dataset extended = members.withColumn("score", ColumnType.DECIMAL);

        assertEquals(Arrays.asList("id", "name", "score"), extended.getColumns());
        assertNull(extended.getValue(0, "score"));
        assertEquals(ColumnType.DECIMAL, extended.getColumnType("score"));
        assertFalse(members.hasColumn("score"));

        Dataset same = members.withColumn("id", null);
        assertEquals(Arrays.asList("id", "name"), same.getColumns());
        assertEquals(1, same.getValue(0, "id"));
    }

    @Test
    void testAddRow_ignoresUnknownColumnsAndFillsMissing() {
        members.addRow(row("id", 3, "extra", "x"));

        assertEquals(3, members.size());
        assertNull(members.getValue(2, "name"));
        assertFalse(members.getRows().get(2).containsKey("extra"));
        assertEquals(1, members.nonNullCount("name"));
    }
}
