package com.pipeline.etl.model;

import com.pipeline.etl.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 从组件 params / config 映射中读取带类型的取值。
 * 缺失或类型不符的必需项以ConfigurationException报告。
 */
public final class ConfigMaps {

    private ConfigMaps() {}

    public static String getString(Map<String, ?> map, String key, String defaultValue) {
        Object value = map == null ? null : map.get(key);
        return value == null ? defaultValue : value.toString();
    }

    public static String requireString(Map<String, ?> map, String key, String owner) {
        String value = getString(map, key, null);
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Missing required parameter '" + key + "' for " + owner);
        }
        return value;
    }

    public static Double getDouble(Map<String, ?> map, String key, Double defaultValue) {
        Object value = map == null ? null : map.get(key);
        if (value == null) return defaultValue;
        Double d = ColumnType.toDouble(value);
        if (d == null) {
            throw new ConfigurationException("Parameter '" + key + "' must be numeric, got: " + value);
        }
        return d;
    }

    public static int getInt(Map<String, ?> map, String key, int defaultValue) {
        Double d = getDouble(map, key, null);
        return d == null ? defaultValue : d.intValue();
    }

    public static boolean getBoolean(Map<String, ?> map, String key, boolean defaultValue) {
        Object value = map == null ? null : map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString().trim());
    }

    /**
     * 读取字符串列表；单个字符串视为只有一个元素的列表
     */
    public static List<String> getStringList(Map<String, ?> map, String key) {
        Object value = map == null ? null : map.get(key);
        List<String> result = new ArrayList<>();
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                if (item != null) result.add(item.toString());
            }
        } else if (value != null) {
            result.add(value.toString());
        }
        return result;
    }

    /**
     * 读取映射列表，如规则列表、行列表
     */
    @SuppressWarnings("unchecked")
    public static List<Map<String, Object>> getMapList(Map<String, ?> map, String key, String owner) {
        Object value = map == null ? null : map.get(key);
        List<Map<String, Object>> result = new ArrayList<>();
        if (value == null) return result;
        if (!(value instanceof Collection)) {
            throw new ConfigurationException("Parameter '" + key + "' of " + owner + " must be a list");
        }
        for (Object item : (Collection<?>) value) {
            if (!(item instanceof Map)) {
                throw new ConfigurationException("Entries of '" + key + "' in " + owner + " must be objects");
            }
            result.add((Map<String, Object>) item);
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> getMap(Map<String, ?> map, String key) {
        Object value = map == null ? null : map.get(key);
        if (value == null) return null;
        if (!(value instanceof Map)) {
            throw new ConfigurationException("Parameter '" + key + "' must be an object");
        }
        return (Map<String, Object>) value;
    }
}
