package com.pipeline.etl.components;

import com.pipeline.etl.core.Transformer;
import com.pipeline.etl.exception.ConfigurationException;
import com.pipeline.etl.model.ColumnType;
import com.pipeline.etl.model.ConfigMaps;
import com.pipeline.etl.model.Dataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 通用数据清洗转换器。
 *
 * 自动清洗（auto_clean，默认开启）：删除全空行、去除字符串首尾空白并把空串置为null、删除重复行。
 * 之后按顺序应用 cleaning_rules 中的规则。规则种类在构造时校验，未知种类抛出ConfigurationException。
 */
public class DataCleaner implements Transformer {

    private static final Logger log = LoggerFactory.getLogger(DataCleaner.class);

    private static final Pattern EMAIL_PATTERN =
            Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");
    private static final Pattern NON_DIGIT = Pattern.compile("\\D");

    /**
     * 清洗规则种类
     */
    public enum CleaningRuleType {
        REMOVE_NULLS,
        STANDARDIZE_CASE,
        REMOVE_SPECIAL_CHARS,
        STANDARDIZE_PHONE,
        STANDARDIZE_EMAIL,
        FILL_MISSING;

        public static CleaningRuleType fromValue(String value) {
            if (value != null) {
                for (CleaningRuleType type : values()) {
                    if (type.name().equalsIgnoreCase(value.trim())) return type;
                }
            }
            throw new ConfigurationException("Unknown cleaning rule type: " + value);
        }
    }

    /**
     * 已解析的清洗规则
     */
    public static final class CleaningRule {
        private final CleaningRuleType type;
        private final Map<String, Object> config;

        CleaningRule(CleaningRuleType type, Map<String, Object> config) {
            this.type = type;
            this.config = config;
        }

        public CleaningRuleType getType() { return type; }
        public Map<String, Object> getConfig() { return config; }
    }

    private static final Set<String> CASE_TYPES = Set.of("upper", "lower", "title", "sentence");
    private static final Set<String> FILL_STRATEGIES =
            Set.of("mean", "median", "mode", "forward_fill", "backward_fill");

    private final String name;
    private final boolean autoClean;
    private final List<CleaningRule> rules;

    public DataCleaner(String name, boolean autoClean, List<Map<String, Object>> ruleConfigs) {
        this.name = name;
        this.autoClean = autoClean;
        List<CleaningRule> parsed = new ArrayList<>();
        for (Map<String, Object> ruleConfig : ruleConfigs) {
            parsed.add(parseRule(ruleConfig));
        }
        this.rules = Collections.unmodifiableList(parsed);
    }

    private CleaningRule parseRule(Map<String, Object> config) {
        CleaningRuleType type = CleaningRuleType.fromValue(ConfigMaps.getString(config, "type", null));
        String owner = "cleaning rule '" + type.name().toLowerCase() + "' of " + name;
        switch (type) {
            case REMOVE_NULLS:
                double threshold = ConfigMaps.getDouble(config, "threshold", 0.0);
                if (threshold < 0 || threshold > 1) {
                    throw new ConfigurationException("Threshold of " + owner + " must be within [0, 1]");
                }
                break;
            case STANDARDIZE_CASE:
                ConfigMaps.requireString(config, "column", owner);
                String caseType = ConfigMaps.getString(config, "case_type", "title");
                if (!CASE_TYPES.contains(caseType)) {
                    throw new ConfigurationException("Unknown case_type '" + caseType + "' in " + owner);
                }
                break;
            case REMOVE_SPECIAL_CHARS:
                ConfigMaps.requireString(config, "column", owner);
                try {
                    Pattern.compile(ConfigMaps.getString(config, "pattern", "[^\\w\\s]"));
                } catch (PatternSyntaxException e) {
                    throw new ConfigurationException("Invalid pattern in " + owner, e);
                }
                break;
            case FILL_MISSING:
                ConfigMaps.requireString(config, "column", owner);
                String strategy = ConfigMaps.getString(config, "strategy", "mean");
                if (!FILL_STRATEGIES.contains(strategy)) {
                    throw new ConfigurationException("Unknown fill strategy '" + strategy + "' in " + owner);
                }
                break;
            case STANDARDIZE_PHONE:
            case STANDARDIZE_EMAIL:
            default:
                ConfigMaps.requireString(config, "column", owner);
                break;
        }
        return new CleaningRule(type, new LinkedHashMap<>(config));
    }

    @Override
    public Dataset transform(Dataset data) {
        Dataset df = data.copy();
        if (autoClean) {
            df = autoClean(df);
        }
        for (CleaningRule rule : rules) {
            df = applyRule(df, rule);
        }
        log.info("Cleaner '{}' completed: {} -> {} rows", name, data.size(), df.size());
        return df;
    }

    // ==================== 自动清洗 ====================

    private Dataset autoClean(Dataset df) {
        int originalRows = df.size();
        Dataset cleaned = df.emptyCopy();
        for (Map<String, Object> row : df.getRows()) {
            Map<String, Object> normalized = new LinkedHashMap<>();
            boolean allNull = true;
            for (Map.Entry<String, Object> cell : row.entrySet()) {
                Object value = cell.getValue();
                if (value instanceof String) {
                    String trimmed = ((String) value).trim();
                    value = trimmed.isEmpty() ? null : trimmed;
                }
                normalized.put(cell.getKey(), value);
                allNull &= value == null;
            }
            if (!allNull) {
                cleaned.addRow(normalized);
            }
        }
        cleaned = dropDuplicates(cleaned);
        log.debug("Auto-cleaning removed {} rows", originalRows - cleaned.size());
        return cleaned;
    }

    private Dataset dropDuplicates(Dataset df) {
        Dataset result = df.emptyCopy();
        Set<List<Object>> seen = new HashSet<>();
        for (Map<String, Object> row : df.getRows()) {
            if (seen.add(new ArrayList<>(row.values()))) {
                result.addRow(row);
            }
        }
        return result;
    }

    // ==================== 清洗规则 ====================

    private Dataset applyRule(Dataset df, CleaningRule rule) {
        Map<String, Object> config = rule.getConfig();
        switch (rule.getType()) {
            case REMOVE_NULLS:
                return removeNulls(df, config);
            case STANDARDIZE_CASE:
                String caseType = ConfigMaps.getString(config, "case_type", "title");
                return mapColumn(df, column(df, config), v -> v instanceof String ? changeCase((String) v, caseType) : v);
            case REMOVE_SPECIAL_CHARS:
                Pattern pattern = Pattern.compile(ConfigMaps.getString(config, "pattern", "[^\\w\\s]"));
                String replacement = ConfigMaps.getString(config, "replacement", "");
                return mapColumn(df, column(df, config),
                        v -> v instanceof String ? pattern.matcher((String) v).replaceAll(replacement) : v);
            case STANDARDIZE_PHONE:
                return mapColumn(df, column(df, config), DataCleaner::standardizePhone);
            case STANDARDIZE_EMAIL:
                return mapColumn(df, column(df, config), DataCleaner::standardizeEmail);
            case FILL_MISSING:
                return fillMissing(df, column(df, config), config);
            default:
                throw new ConfigurationException("Unsupported cleaning rule: " + rule.getType());
        }
    }

    private String column(Dataset df, Map<String, Object> config) {
        String column = ConfigMaps.getString(config, "column", null);
        if (!df.hasColumn(column)) {
            throw new IllegalArgumentException("Cleaner '" + name + "' references unknown column '" + column + "'");
        }
        return column;
    }

    private Dataset mapColumn(Dataset df, String column, java.util.function.UnaryOperator<Object> fn) {
        Dataset result = df.copy();
        for (int i = 0; i < result.size(); i++) {
            result.setValue(i, column, fn.apply(result.getValue(i, column)));
        }
        return result;
    }

    private Dataset removeNulls(Dataset df, Map<String, Object> config) {
        List<String> columns = ConfigMaps.getStringList(config, "columns");
        if (columns.isEmpty()) {
            columns = df.getColumns();
        }
        for (String column : columns) {
            if (!df.hasColumn(column)) {
                throw new IllegalArgumentException("Cleaner '" + name + "' references unknown column '" + column + "'");
            }
        }
        // 0 = 任一列为空即删除，1 = 全部为空才删除，其余按空值比例
        double threshold = ConfigMaps.getDouble(config, "threshold", 0.0);
        Dataset result = df.emptyCopy();
        for (Map<String, Object> row : df.getRows()) {
            long nulls = columns.stream().filter(c -> row.get(c) == null).count();
            boolean drop;
            if (threshold == 0.0) {
                drop = nulls > 0;
            } else if (threshold == 1.0) {
                drop = nulls == columns.size();
            } else {
                drop = (double) nulls / columns.size() > threshold;
            }
            if (!drop) {
                result.addRow(row);
            }
        }
        return result;
    }

    private Dataset fillMissing(Dataset df, String column, Map<String, Object> config) {
        Dataset result = df.copy();
        List<Object> values = result.getColumnValues(column);
        Object explicit = config.get("value");
        String strategy = ConfigMaps.getString(config, "strategy", "mean");

        if (explicit != null) {
            fillWith(result, column, explicit);
            return result;
        }

        switch (strategy) {
            case "mean":
            case "median":
                double[] numbers = values.stream()
                        .map(ColumnType::toDouble)
                        .filter(Objects::nonNull)
                        .mapToDouble(Double::doubleValue)
                        .sorted()
                        .toArray();
                if (numbers.length == 0) return result;
                double fill;
                if ("mean".equals(strategy)) {
                    fill = Arrays.stream(numbers).average().orElse(0.0);
                } else {
                    int n = numbers.length;
                    fill = n % 2 == 1 ? numbers[n / 2] : (numbers[n / 2 - 1] + numbers[n / 2]) / 2.0;
                }
                fillWith(result, column, fill);
                return result;
            case "mode":
                Object mode = mostFrequent(values);
                if (mode != null) fillWith(result, column, mode);
                return result;
            case "forward_fill":
                Object last = null;
                for (int i = 0; i < result.size(); i++) {
                    Object v = result.getValue(i, column);
                    if (v == null) {
                        result.setValue(i, column, last);
                    } else {
                        last = v;
                    }
                }
                return result;
            case "backward_fill":
                Object next = null;
                for (int i = result.size() - 1; i >= 0; i--) {
                    Object v = result.getValue(i, column);
                    if (v == null) {
                        result.setValue(i, column, next);
                    } else {
                        next = v;
                    }
                }
                return result;
            default:
                throw new ConfigurationException("Unknown fill strategy: " + strategy);
        }
    }

    private static void fillWith(Dataset df, String column, Object value) {
        for (int i = 0; i < df.size(); i++) {
            if (df.getValue(i, column) == null) {
                df.setValue(i, column, value);
            }
        }
    }

    /** 出现次数最多的非空值，次数相同取先出现者 */
    private static Object mostFrequent(List<Object> values) {
        Map<Object, Integer> counts = new LinkedHashMap<>();
        for (Object v : values) {
            if (v != null) counts.merge(v, 1, Integer::sum);
        }
        Object best = null;
        int bestCount = 0;
        for (Map.Entry<Object, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    static String changeCase(String value, String caseType) {
        switch (caseType) {
            case "upper":
                return value.toUpperCase();
            case "lower":
                return value.toLowerCase();
            case "sentence":
                return value.isEmpty() ? value
                        : Character.toUpperCase(value.charAt(0)) + value.substring(1).toLowerCase();
            case "title":
            default:
                StringBuilder sb = new StringBuilder(value.length());
                boolean startOfWord = true;
                for (char c : value.toCharArray()) {
                    if (Character.isLetter(c)) {
                        sb.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                        startOfWord = false;
                    } else {
                        sb.append(c);
                        startOfWord = true;
                    }
                }
                return sb.toString();
        }
    }

    /**
     * 10位数字格式化为 (xxx) xxx-xxxx，以1开头的11位数字格式化为 +1 (xxx) xxx-xxxx，其余原样返回
     */
    static Object standardizePhone(Object value) {
        if (value == null) return null;
        String digits = NON_DIGIT.matcher(value.toString()).replaceAll("");
        if (digits.length() == 10) {
            return "(" + digits.substring(0, 3) + ") " + digits.substring(3, 6) + "-" + digits.substring(6);
        }
        if (digits.length() == 11 && digits.charAt(0) == '1') {
            return "+1 (" + digits.substring(1, 4) + ") " + digits.substring(4, 7) + "-" + digits.substring(7);
        }
        return value;
    }

    /**
     * 转小写并去除空白；格式不合法的邮箱置为null
     */
    static Object standardizeEmail(Object value) {
        if (value == null) return null;
        String email = value.toString().trim().toLowerCase();
        return EMAIL_PATTERN.matcher(email).matches() ? email : null;
    }

    public String getName() { return name; }
    public boolean isAutoClean() { return autoClean; }
    public List<CleaningRule> getRules() { return rules; }
}
