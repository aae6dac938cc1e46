package com.pipeline.etl.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.function.Function;

/**
 * 数据集列的声明类型。
 * 未显式声明时按非空值推断，用于类型一致性检查和数据画像。
 */
public enum ColumnType {
    INTEGER,
    DECIMAL,
    BOOLEAN,
    TIMESTAMP,
    STRING;

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss"));

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy/MM/dd"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy"),
            DateTimeFormatter.ofPattern("dd.MM.yyyy"));

    private static final List<Function<String, Instant>> TEXT_PARSERS = buildTextParsers();

    public boolean isNumeric() {
        return this == INTEGER || this == DECIMAL;
    }

    /**
     * 判断值能否转换为本类型。null视为不可判断，调用方应只传非空值。
     */
    public boolean isCoercible(Object value) {
        if (value == null) return false;
        switch (this) {
            case INTEGER:
                if (value instanceof Integer || value instanceof Long
                        || value instanceof Short || value instanceof Byte) {
                    return true;
                }
                Double d = toDouble(value);
                return d != null && d == Math.rint(d);
            case DECIMAL:
                return toDouble(value) != null;
            case BOOLEAN:
                if (value instanceof Boolean) return true;
                String s = value.toString().trim();
                return s.equalsIgnoreCase("true") || s.equalsIgnoreCase("false");
            case TIMESTAMP:
                return toInstant(value) != null;
            case STRING:
            default:
                return !value.toString().isEmpty();
        }
    }

    /**
     * 按非空值推断列类型：全部整数为INTEGER，全部数值为DECIMAL，
     * 全部布尔为BOOLEAN，全部时间对象为TIMESTAMP，否则为STRING。
     */
    public static ColumnType infer(Collection<?> values) {
        boolean any = false;
        boolean allIntegral = true;
        boolean allNumeric = true;
        boolean allBoolean = true;
        boolean allTemporal = true;
        for (Object v : values) {
            if (v == null) continue;
            any = true;
            boolean numeric = v instanceof Number;
            allNumeric &= numeric;
            allIntegral &= numeric && (v instanceof Integer || v instanceof Long
                    || v instanceof Short || v instanceof Byte);
            allBoolean &= v instanceof Boolean;
            allTemporal &= v instanceof Instant || v instanceof Date || v instanceof LocalDate
                    || v instanceof LocalDateTime || v instanceof OffsetDateTime
                    || v instanceof ZonedDateTime;
        }
        if (!any) return STRING;
        if (allIntegral) return INTEGER;
        if (allNumeric) return DECIMAL;
        if (allBoolean) return BOOLEAN;
        if (allTemporal) return TIMESTAMP;
        return STRING;
    }

    /**
     * 数值转换：Number直接取值，字符串尝试解析；无法转换返回null
     */
    public static Double toDouble(Object value) {
        if (value == null) return null;
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return Double.isNaN(d) ? null : d;
        }
        if (value instanceof Boolean) return null;
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static List<Function<String, Instant>> buildTextParsers() {
        List<Function<String, Instant>> parsers = new ArrayList<>();
        parsers.add(Instant::parse);
        parsers.add(text -> OffsetDateTime.parse(text).toInstant());
        parsers.add(text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC));
        parsers.add(text -> LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC));
        for (DateTimeFormatter f : DATE_TIME_FORMATS) {
            parsers.add(text -> LocalDateTime.parse(text, f).toInstant(ZoneOffset.UTC));
        }
        for (DateTimeFormatter f : DATE_FORMATS) {
            parsers.add(text -> LocalDate.parse(text, f).atStartOfDay().toInstant(ZoneOffset.UTC));
        }
        return parsers;
    }

    /** 单一格式解析，格式不匹配返回null */
    private static Instant tryParse(String text, Function<String, Instant> parser) {
        try {
            return parser.apply(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * 时间转换：支持常见时间对象和ISO/常用格式字符串；无法转换返回null。
     * 不带时区的值按UTC处理。
     */
    public static Instant toInstant(Object value) {
        if (value == null) return null;
        if (value instanceof Instant) return (Instant) value;
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate().atStartOfDay().toInstant(ZoneOffset.UTC);
        }
        if (value instanceof Date) return ((Date) value).toInstant();
        if (value instanceof LocalDate) return ((LocalDate) value).atStartOfDay().toInstant(ZoneOffset.UTC);
        if (value instanceof LocalDateTime) return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
        if (value instanceof OffsetDateTime) return ((OffsetDateTime) value).toInstant();
        if (value instanceof ZonedDateTime) return ((ZonedDateTime) value).toInstant();
        if (!(value instanceof CharSequence)) return null;

        String text = value.toString().trim();
        if (text.isEmpty()) return null;
        for (Function<String, Instant> parser : TEXT_PARSERS) {
            Instant parsed = tryParse(text, parser);
            if (parsed != null) return parsed;
        }
        return null;
    }
}
