package com.pipeline.etl.components;

import com.pipeline.etl.core.Transformer;
import com.pipeline.etl.core.WarningSource;
import com.pipeline.etl.exception.ConfigurationException;
import com.pipeline.etl.model.ColumnType;
import com.pipeline.etl.model.ConfigMaps;
import com.pipeline.etl.model.Dataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.*;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 行级校验转换器。
 *
 * 每条校验规则给不合格的行追加一条错误信息，汇总在 _validation_errors 列中（形如 "msg1; msg2; "）。
 * 严格模式下删除不合格的行；非严格模式保留全部行和错误列。没有不合格行时不输出错误列。
 * 与质量校验器不同，这里只做行过滤，不产生质量指标，也不会中断管道。
 */
public class DataValidator implements Transformer, WarningSource {

    private static final Logger log = LoggerFactory.getLogger(DataValidator.class);

    public static final String ERROR_COLUMN = "_validation_errors";

    private static final Pattern EMAIL_PATTERN =
            Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");
    private static final Pattern PHONE_PATTERN =
            Pattern.compile("^\\+?1?[-.\\s]?\\(?[0-9]{3}\\)?[-.\\s]?[0-9]{3}[-.\\s]?[0-9]{4}$");

    /**
     * 行级校验种类
     */
    public enum CheckType {
        NOT_NULL,
        EMAIL_FORMAT,
        PHONE_FORMAT,
        RANGE,
        LENGTH,
        PATTERN,
        IN_LIST,
        UNIQUE,
        DATE_FORMAT;

        public static CheckType fromValue(String value) {
            if (value != null) {
                for (CheckType type : values()) {
                    if (type.name().equalsIgnoreCase(value.trim())) return type;
                }
            }
            throw new ConfigurationException("Unknown validation rule type: " + value);
        }
    }

    /**
     * 已解析的校验规则，正则与日期格式在构造时编译
     */
    public static final class RowCheck {
        private final CheckType type;
        private final String column;
        private final String errorMessage;
        private final Map<String, Object> config;
        private final Pattern pattern;
        private final DateTimeFormatter dateFormat;

        RowCheck(CheckType type, String column, String errorMessage, Map<String, Object> config,
                 Pattern pattern, DateTimeFormatter dateFormat) {
            this.type = type;
            this.column = column;
            this.errorMessage = errorMessage;
            this.config = config;
            this.pattern = pattern;
            this.dateFormat = dateFormat;
        }

        public CheckType getType() { return type; }
        public String getColumn() { return column; }
        public String getErrorMessage() { return errorMessage; }
        public Map<String, Object> getConfig() { return config; }
    }

    private final String name;
    private final boolean strictMode;
    private final List<RowCheck> checks;
    private final List<String> pendingWarnings = new ArrayList<>();

    public DataValidator(String name, boolean strictMode, List<Map<String, Object>> ruleConfigs) {
        this.name = name;
        this.strictMode = strictMode;
        List<RowCheck> parsed = new ArrayList<>();
        for (Map<String, Object> ruleConfig : ruleConfigs) {
            parsed.add(parseCheck(ruleConfig));
        }
        this.checks = Collections.unmodifiableList(parsed);
    }

    private RowCheck parseCheck(Map<String, Object> config) {
        CheckType type = CheckType.fromValue(ConfigMaps.getString(config, "type", null));
        String typeName = type.name().toLowerCase();
        String owner = "validation rule '" + typeName + "' of " + name;
        String column = ConfigMaps.requireString(config, "column", owner);
        String message = ConfigMaps.getString(config, "error_message", "Validation failed: " + typeName);
        Pattern pattern = null;
        DateTimeFormatter dateFormat = null;
        switch (type) {
            case EMAIL_FORMAT:
                pattern = EMAIL_PATTERN;
                break;
            case PHONE_FORMAT:
                pattern = PHONE_PATTERN;
                break;
            case PATTERN:
                try {
                    pattern = Pattern.compile(ConfigMaps.requireString(config, "pattern", owner));
                } catch (PatternSyntaxException e) {
                    throw new ConfigurationException("Invalid pattern in " + owner, e);
                }
                break;
            case RANGE:
                if (config.get("min") == null && config.get("max") == null) {
                    throw new ConfigurationException("Range in " + owner + " needs 'min' or 'max'");
                }
                ConfigMaps.getDouble(config, "min", null);
                ConfigMaps.getDouble(config, "max", null);
                break;
            case LENGTH:
                int minLength = ConfigMaps.getInt(config, "min_length", 0);
                int maxLength = ConfigMaps.getInt(config, "max_length", Integer.MAX_VALUE);
                if (minLength < 0 || maxLength < minLength) {
                    throw new ConfigurationException("Invalid length bounds in " + owner);
                }
                break;
            case IN_LIST:
                if (!(config.get("values") instanceof Collection)) {
                    throw new ConfigurationException("Parameter 'values' of " + owner + " must be a list");
                }
                break;
            case DATE_FORMAT:
                dateFormat = toFormatter(ConfigMaps.getString(config, "format", "%Y-%m-%d"), owner);
                break;
            case NOT_NULL:
            case UNIQUE:
            default:
                break;
        }
        return new RowCheck(type, column, message, new LinkedHashMap<>(config), pattern, dateFormat);
    }

    /**
     * strftime 风格格式（%Y %m %d %H %M %S）转为严格解析的DateTimeFormatter
     */
    static DateTimeFormatter toFormatter(String format, String owner) {
        StringBuilder pattern = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < format.length(); i++) {
            char c = format.charAt(i);
            if (c != '%') {
                literal.append(c);
                continue;
            }
            if (i + 1 >= format.length()) {
                throw new ConfigurationException("Dangling '%' in date format of " + owner);
            }
            flushLiteral(pattern, literal);
            char directive = format.charAt(++i);
            switch (directive) {
                case 'Y': pattern.append("uuuu"); break;
                case 'm': pattern.append("MM"); break;
                case 'd': pattern.append("dd"); break;
                case 'H': pattern.append("HH"); break;
                case 'M': pattern.append("mm"); break;
                case 'S': pattern.append("ss"); break;
                case '%': literal.append('%'); break;
                default:
                    throw new ConfigurationException("Unsupported date directive '%" + directive + "' in " + owner);
            }
        }
        flushLiteral(pattern, literal);
        return DateTimeFormatter.ofPattern(pattern.toString()).withResolverStyle(ResolverStyle.STRICT);
    }

    private static void flushLiteral(StringBuilder pattern, StringBuilder literal) {
        if (literal.length() > 0) {
            pattern.append('\'').append(literal.toString().replace("'", "''")).append('\'');
            literal.setLength(0);
        }
    }

    @Override
    public Dataset transform(Dataset data) {
        for (RowCheck check : checks) {
            if (!data.hasColumn(check.getColumn())) {
                throw new IllegalArgumentException("Validator '" + name + "' references unknown column '"
                        + check.getColumn() + "'");
            }
        }

        List<StringBuilder> errors = new ArrayList<>(data.size());
        for (int i = 0; i < data.size(); i++) {
            errors.add(new StringBuilder());
        }
        for (RowCheck check : checks) {
            boolean[] invalid = evaluate(data, check);
            for (int i = 0; i < invalid.length; i++) {
                if (invalid[i]) {
                    errors.get(i).append(check.getErrorMessage()).append("; ");
                }
            }
        }

        long invalidCount = errors.stream().filter(e -> e.length() > 0).count();
        if (invalidCount == 0) {
            return data.copy();
        }

        String warning = "Found " + invalidCount + " rows with validation errors";
        log.warn("Validator '{}': {}", name, warning);
        Dataset result;
        if (strictMode) {
            result = data.emptyCopy();
            List<Map<String, Object>> rows = data.getRows();
            for (int i = 0; i < rows.size(); i++) {
                if (errors.get(i).length() == 0) {
                    result.addRow(rows.get(i));
                }
            }
            log.info("Validator '{}' removed {} invalid rows (strict mode)", name, invalidCount);
            warning += ", removed in strict mode";
        } else {
            result = data.withColumn(ERROR_COLUMN, ColumnType.STRING);
            for (int i = 0; i < result.size(); i++) {
                result.setValue(i, ERROR_COLUMN, errors.get(i).toString());
            }
        }
        synchronized (pendingWarnings) {
            pendingWarnings.add(warning);
        }
        return result;
    }

    /**
     * 逐行判定，true 表示该行不满足规则。
     * 格式类规则（email/phone/pattern/in_list）视null为不合格，range/length/date_format 跳过null。
     */
    private boolean[] evaluate(Dataset data, RowCheck check) {
        List<Object> values = data.getColumnValues(check.getColumn());
        boolean[] invalid = new boolean[values.size()];
        Map<String, Object> config = check.getConfig();
        switch (check.getType()) {
            case NOT_NULL:
                for (int i = 0; i < invalid.length; i++) {
                    invalid[i] = values.get(i) == null;
                }
                break;
            case EMAIL_FORMAT:
            case PHONE_FORMAT:
            case PATTERN:
                for (int i = 0; i < invalid.length; i++) {
                    Object v = values.get(i);
                    invalid[i] = v == null || !check.pattern.matcher(v.toString()).lookingAt();
                }
                break;
            case RANGE:
                Double min = ConfigMaps.getDouble(config, "min", null);
                Double max = ConfigMaps.getDouble(config, "max", null);
                for (int i = 0; i < invalid.length; i++) {
                    Object v = values.get(i);
                    if (v == null) continue;
                    Double d = ColumnType.toDouble(v);
                    invalid[i] = d == null || (min != null && d < min) || (max != null && d > max);
                }
                break;
            case LENGTH:
                int minLength = ConfigMaps.getInt(config, "min_length", 0);
                int maxLength = ConfigMaps.getInt(config, "max_length", Integer.MAX_VALUE);
                for (int i = 0; i < invalid.length; i++) {
                    Object v = values.get(i);
                    if (v == null) continue;
                    int length = v.toString().length();
                    invalid[i] = length < minLength || length > maxLength;
                }
                break;
            case IN_LIST:
                Set<String> allowed = new HashSet<>();
                boolean nullAllowed = false;
                for (Object allowedValue : (Collection<?>) config.get("values")) {
                    if (allowedValue == null) {
                        nullAllowed = true;
                    } else {
                        allowed.add(allowedValue.toString());
                    }
                }
                for (int i = 0; i < invalid.length; i++) {
                    Object v = values.get(i);
                    invalid[i] = v == null ? !nullAllowed : !allowed.contains(v.toString());
                }
                break;
            case UNIQUE:
                Map<Object, Integer> counts = new HashMap<>();
                for (Object v : values) {
                    counts.merge(Optional.ofNullable(v), 1, Integer::sum);
                }
                // 重复值的所有出现都不合格
                for (int i = 0; i < invalid.length; i++) {
                    invalid[i] = counts.get(Optional.ofNullable(values.get(i))) > 1;
                }
                break;
            case DATE_FORMAT:
                for (int i = 0; i < invalid.length; i++) {
                    Object v = values.get(i);
                    if (v == null) continue;
                    try {
                        check.dateFormat.parse(v.toString().trim());
                    } catch (DateTimeException e) {
                        invalid[i] = true;
                    }
                }
                break;
            default:
                throw new ConfigurationException("Unsupported validation rule: " + check.getType());
        }
        return invalid;
    }

    @Override
    public List<String> drainWarnings() {
        synchronized (pendingWarnings) {
            List<String> drained = new ArrayList<>(pendingWarnings);
            pendingWarnings.clear();
            return drained;
        }
    }

    public String getName() { return name; }
    public boolean isStrictMode() { return strictMode; }
    public List<RowCheck> getChecks() { return checks; }
}
