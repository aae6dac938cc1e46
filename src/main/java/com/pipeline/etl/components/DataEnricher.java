package com.pipeline.etl.components;

import com.pipeline.etl.core.Transformer;
import com.pipeline.etl.exception.ConfigurationException;
import com.pipeline.etl.model.ColumnType;
import com.pipeline.etl.model.ConfigMaps;
import com.pipeline.etl.model.Dataset;
import com.pipeline.etl.model.HashIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * 数据增强转换器，按顺序应用 enrichment_rules 派生新列。
 *
 * 规则种类在构造时校验，未知种类或缺失必需参数抛出ConfigurationException。
 * 运行时引用不存在的列抛出IllegalArgumentException。
 * 时间相关的规则（add_timestamp、calculate_age）使用注入的时钟，日期一律按UTC取值。
 */
public class DataEnricher implements Transformer {

    private static final Logger log = LoggerFactory.getLogger(DataEnricher.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * 增强规则种类
     */
    public enum EnrichmentType {
        ADD_TIMESTAMP,
        ADD_ROW_ID,
        ADD_HASH,
        CATEGORY_MAPPING,
        CALCULATE_AGE,
        EXTRACT_DATE_PARTS,
        LOOKUP_ENRICHMENT,
        TEXT_FEATURES;

        public static EnrichmentType fromValue(String value) {
            if (value != null) {
                for (EnrichmentType type : values()) {
                    if (type.name().equalsIgnoreCase(value.trim())) return type;
                }
            }
            throw new ConfigurationException("Unknown enrichment rule type: " + value);
        }
    }

    /**
     * 已解析的增强规则
     */
    public static final class EnrichmentRule {
        private final EnrichmentType type;
        private final Map<String, Object> config;

        EnrichmentRule(EnrichmentType type, Map<String, Object> config) {
            this.type = type;
            this.config = config;
        }

        public EnrichmentType getType() { return type; }
        public Map<String, Object> getConfig() { return config; }
    }

    private static final Set<String> DATE_PARTS = Set.of("year", "month", "day", "weekday", "quarter");
    private static final Set<String> TEXT_FEATURES =
            Set.of("length", "word_count", "uppercase_count", "digit_count");

    private final String name;
    private final List<EnrichmentRule> rules;
    private final Map<String, List<Map<String, Object>>> lookupData;
    private final Clock clock;

    /**
     * @param lookupData lookup_enrichment 使用的参考表（表名 -> 行列表），可为空
     */
    public DataEnricher(String name, List<Map<String, Object>> ruleConfigs,
                        Map<String, List<Map<String, Object>>> lookupData, Clock clock) {
        this.name = name;
        this.clock = clock;
        this.lookupData = lookupData == null ? Collections.emptyMap() : new LinkedHashMap<>(lookupData);
        List<EnrichmentRule> parsed = new ArrayList<>();
        for (Map<String, Object> ruleConfig : ruleConfigs) {
            parsed.add(parseRule(ruleConfig));
        }
        this.rules = Collections.unmodifiableList(parsed);
    }

    private EnrichmentRule parseRule(Map<String, Object> config) {
        EnrichmentType type = EnrichmentType.fromValue(ConfigMaps.getString(config, "type", null));
        String owner = "enrichment rule '" + type.name().toLowerCase() + "' of " + name;
        switch (type) {
            case ADD_HASH:
                if (ConfigMaps.getStringList(config, "source_columns").isEmpty()) {
                    throw new ConfigurationException("Missing required parameter 'source_columns' for " + owner);
                }
                ConfigMaps.requireString(config, "target_column", owner);
                break;
            case CATEGORY_MAPPING:
                ConfigMaps.requireString(config, "source_column", owner);
                ConfigMaps.requireString(config, "target_column", owner);
                if (ConfigMaps.getMap(config, "mapping") == null) {
                    throw new ConfigurationException("Missing required parameter 'mapping' for " + owner);
                }
                break;
            case CALCULATE_AGE:
                ConfigMaps.requireString(config, "birth_date_column", owner);
                String reference = ConfigMaps.getString(config, "reference_date", null);
                if (reference != null && ColumnType.toInstant(reference) == null) {
                    throw new ConfigurationException("Unparseable reference_date '" + reference + "' in " + owner);
                }
                break;
            case EXTRACT_DATE_PARTS:
                ConfigMaps.requireString(config, "date_column", owner);
                requireSubset(ConfigMaps.getStringList(config, "parts"), DATE_PARTS, "date part", owner);
                break;
            case LOOKUP_ENRICHMENT:
                ConfigMaps.requireString(config, "key_column", owner);
                String table = ConfigMaps.requireString(config, "lookup_table", owner);
                if (!lookupData.containsKey(table)) {
                    throw new ConfigurationException("Lookup table '" + table + "' is not defined for " + owner);
                }
                if (ConfigMaps.getStringList(config, "target_columns").isEmpty()) {
                    throw new ConfigurationException("Missing required parameter 'target_columns' for " + owner);
                }
                break;
            case TEXT_FEATURES:
                ConfigMaps.requireString(config, "text_column", owner);
                requireSubset(ConfigMaps.getStringList(config, "features"), TEXT_FEATURES, "text feature", owner);
                break;
            case ADD_TIMESTAMP:
            case ADD_ROW_ID:
            default:
                break;
        }
        return new EnrichmentRule(type, new LinkedHashMap<>(config));
    }

    private static void requireSubset(List<String> values, Set<String> allowed, String what, String owner) {
        for (String value : values) {
            if (!allowed.contains(value)) {
                throw new ConfigurationException("Unknown " + what + " '" + value + "' in " + owner);
            }
        }
    }

    @Override
    public Dataset transform(Dataset data) {
        Dataset df = data.copy();
        for (EnrichmentRule rule : rules) {
            df = applyRule(df, rule);
        }
        log.info("Enricher '{}' completed: {} rows, {} -> {} columns",
                name, df.size(), data.columnCount(), df.columnCount());
        return df;
    }

    private Dataset applyRule(Dataset df, EnrichmentRule rule) {
        Map<String, Object> config = rule.getConfig();
        switch (rule.getType()) {
            case ADD_TIMESTAMP:
                Instant now = clock.instant();
                return derive(df, ConfigMaps.getString(config, "column_name", "processed_timestamp"),
                        ColumnType.TIMESTAMP, i -> now);
            case ADD_ROW_ID:
                return derive(df, ConfigMaps.getString(config, "column_name", "row_id"),
                        ColumnType.INTEGER, i -> i + 1);
            case ADD_HASH:
                return addHash(df, config);
            case CATEGORY_MAPPING:
                return mapCategory(df, config);
            case CALCULATE_AGE:
                return calculateAge(df, config);
            case EXTRACT_DATE_PARTS:
                return extractDateParts(df, config);
            case LOOKUP_ENRICHMENT:
                return lookup(df, config);
            case TEXT_FEATURES:
                return textFeatures(df, config);
            default:
                throw new ConfigurationException("Unsupported enrichment rule: " + rule.getType());
        }
    }

    private String column(Dataset df, String column) {
        if (!df.hasColumn(column)) {
            throw new IllegalArgumentException("Enricher '" + name + "' references unknown column '" + column + "'");
        }
        return column;
    }

    /** 追加（或覆盖）一列，值由行号计算 */
    private static Dataset derive(Dataset df, String target, ColumnType type, Function<Integer, Object> value) {
        Dataset result = df.withColumn(target, type);
        for (int i = 0; i < result.size(); i++) {
            result.setValue(i, target, value.apply(i));
        }
        return result;
    }

    /**
     * 把源列值按字符串拼接后取MD5，null拼接为"null"
     */
    private Dataset addHash(Dataset df, Map<String, Object> config) {
        List<String> sources = ConfigMaps.getStringList(config, "source_columns");
        sources.forEach(c -> column(df, c));
        return derive(df, ConfigMaps.getString(config, "target_column", null), ColumnType.STRING, i -> {
            StringBuilder content = new StringBuilder();
            for (String source : sources) {
                content.append(df.getValue(i, source));
            }
            return HashIds.md5Hex(content.toString());
        });
    }

    /**
     * 映射表的键按字符串匹配，未命中或为null时取 default_value（默认 Other）
     */
    private Dataset mapCategory(Dataset df, Map<String, Object> config) {
        String source = column(df, ConfigMaps.getString(config, "source_column", null));
        Map<String, Object> mapping = ConfigMaps.getMap(config, "mapping");
        Object defaultValue = config.containsKey("default_value") ? config.get("default_value") : "Other";
        return derive(df, ConfigMaps.getString(config, "target_column", null), null, i -> {
            Object value = df.getValue(i, source);
            Object mapped = value == null ? null : mapping.get(value.toString());
            return mapped != null ? mapped : defaultValue;
        });
    }

    /**
     * 年龄 = 相差天数 / 365 向下取整；出生日期无法解析时为null
     */
    private Dataset calculateAge(Dataset df, Map<String, Object> config) {
        String birthColumn = column(df, ConfigMaps.getString(config, "birth_date_column", null));
        String reference = ConfigMaps.getString(config, "reference_date", null);
        LocalDate referenceDate = toDate(reference != null ? ColumnType.toInstant(reference) : clock.instant());
        return derive(df, ConfigMaps.getString(config, "target_column", "age"), ColumnType.INTEGER, i -> {
            Instant birth = ColumnType.toInstant(df.getValue(i, birthColumn));
            if (birth == null) return null;
            return Math.floorDiv(ChronoUnit.DAYS.between(toDate(birth), referenceDate), 365L);
        });
    }

    /**
     * 生成 {列}_year / _month / _day / _weekday / _quarter，weekday 以周一为0
     */
    private Dataset extractDateParts(Dataset df, Map<String, Object> config) {
        String dateColumn = column(df, ConfigMaps.getString(config, "date_column", null));
        List<String> parts = ConfigMaps.getStringList(config, "parts");
        if (parts.isEmpty()) {
            parts = List.of("year", "month", "day");
        }
        List<LocalDate> dates = new ArrayList<>(df.size());
        for (Object value : df.getColumnValues(dateColumn)) {
            Instant instant = ColumnType.toInstant(value);
            dates.add(instant == null ? null : toDate(instant));
        }
        Dataset result = df;
        for (String part : parts) {
            Function<LocalDate, Integer> extractor = datePart(part);
            result = derive(result, dateColumn + "_" + part, ColumnType.INTEGER, i -> {
                LocalDate date = dates.get(i);
                return date == null ? null : extractor.apply(date);
            });
        }
        return result;
    }

    private static Function<LocalDate, Integer> datePart(String part) {
        switch (part) {
            case "year":
                return LocalDate::getYear;
            case "month":
                return LocalDate::getMonthValue;
            case "day":
                return LocalDate::getDayOfMonth;
            case "weekday":
                return d -> d.getDayOfWeek().getValue() - 1;
            case "quarter":
                return d -> (d.getMonthValue() - 1) / 3 + 1;
            default:
                throw new ConfigurationException("Unknown date part: " + part);
        }
    }

    /**
     * 按键列左连接参考表，只带入 target_columns；一个键命中多行时输出多行，未命中时目标列为null
     */
    private Dataset lookup(Dataset df, Map<String, Object> config) {
        String keyColumn = column(df, ConfigMaps.getString(config, "key_column", null));
        List<String> targets = ConfigMaps.getStringList(config, "target_columns");
        List<Map<String, Object>> table = lookupData.get(ConfigMaps.getString(config, "lookup_table", null));

        Map<Object, List<Map<String, Object>>> index = new HashMap<>();
        for (Map<String, Object> entry : table) {
            Object key = entry.get(keyColumn);
            if (key != null) {
                index.computeIfAbsent(key.toString(), k -> new ArrayList<>()).add(entry);
            }
        }

        Dataset shape = df;
        for (String target : targets) {
            shape = shape.withColumn(target, null);
        }
        Dataset result = shape.emptyCopy();
        for (Map<String, Object> row : df.getRows()) {
            Object key = row.get(keyColumn);
            List<Map<String, Object>> matches = key == null ? null : index.get(key.toString());
            if (matches == null) {
                result.addRow(row);
                continue;
            }
            for (Map<String, Object> match : matches) {
                Map<String, Object> joined = new LinkedHashMap<>(row);
                for (String target : targets) {
                    joined.put(target, match.get(target));
                }
                result.addRow(joined);
            }
        }
        return result;
    }

    /**
     * 文本特征，默认 length 与 word_count；文本为null时特征为null
     */
    private Dataset textFeatures(Dataset df, Map<String, Object> config) {
        String textColumn = column(df, ConfigMaps.getString(config, "text_column", null));
        List<String> features = ConfigMaps.getStringList(config, "features");
        if (features.isEmpty()) {
            features = List.of("length", "word_count");
        }
        Dataset result = df;
        for (String feature : features) {
            Function<String, Integer> extractor = textFeature(feature);
            result = derive(result, textColumn + "_" + feature, ColumnType.INTEGER, i -> {
                Object text = df.getValue(i, textColumn);
                return text == null ? null : extractor.apply(text.toString());
            });
        }
        return result;
    }

    private static Function<String, Integer> textFeature(String feature) {
        switch (feature) {
            case "length":
                return String::length;
            case "word_count":
                return text -> {
                    String trimmed = text.trim();
                    return trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
                };
            case "uppercase_count":
                return text -> (int) text.chars().filter(c -> c >= 'A' && c <= 'Z').count();
            case "digit_count":
                return text -> (int) text.chars().filter(Character::isDigit).count();
            default:
                throw new ConfigurationException("Unknown text feature: " + feature);
        }
    }

    private static LocalDate toDate(Instant instant) {
        return instant.atZone(ZoneOffset.UTC).toLocalDate();
    }

    public String getName() { return name; }
    public List<EnrichmentRule> getRules() { return rules; }
}
