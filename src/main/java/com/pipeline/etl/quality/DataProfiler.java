package com.pipeline.etl.quality;

import com.pipeline.etl.model.ColumnProfile;
import com.pipeline.etl.model.ColumnType;
import com.pipeline.etl.model.DataProfile;
import com.pipeline.etl.model.Dataset;

import java.time.Instant;
import java.util.*;

/**
 * 数据画像计算。与规则结果无关，每次校验都会执行。
 */
public class DataProfiler {

    public static final int MAX_SAMPLE_VALUES = 10;

    public DataProfile profile(Dataset data, Instant timestamp) {
        Map<String, ColumnProfile> columns = new LinkedHashMap<>();
        for (String column : data.getColumns()) {
            columns.put(column, profileColumn(data, column));
        }
        return new DataProfile(data.size(), data.columnCount(), data.duplicateRowCount(), columns, timestamp);
    }

    public ColumnProfile profileColumn(Dataset data, String column) {
        ColumnType type = data.getColumnType(column);
        ColumnProfile profile = new ColumnProfile(column, type);

        List<Object> nonNull = new ArrayList<>();
        for (Object value : data.getColumnValues(column)) {
            if (value != null) nonNull.add(value);
        }
        int rows = data.size();
        long nullCount = rows - nonNull.size();
        long uniqueCount = new HashSet<>(nonNull).size();

        profile.setNullCount(nullCount);
        profile.setNullPercentage(rows == 0 ? 0.0 : (double) nullCount / rows);
        profile.setUniqueCount(uniqueCount);
        profile.setUniquePercentage(rows == 0 ? 0.0 : (double) uniqueCount / rows);

        if (type.isNumeric()) {
            fillNumericStats(profile, nonNull);
        } else if (!nonNull.isEmpty()) {
            List<String> texts = new ArrayList<>();
            for (Object value : nonNull) texts.add(value.toString());
            profile.setMinValue(Collections.min(texts));
            profile.setMaxValue(Collections.max(texts));
        }

        List<String> samples = new ArrayList<>();
        for (Object value : nonNull) {
            if (samples.size() >= MAX_SAMPLE_VALUES) break;
            samples.add(value.toString());
        }
        profile.setSampleValues(samples);
        return profile;
    }

    private void fillNumericStats(ColumnProfile profile, List<Object> values) {
        double[] numbers = values.stream()
                .map(ColumnType::toDouble)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .sorted()
                .toArray();
        if (numbers.length == 0) return;

        int n = numbers.length;
        double sum = 0;
        for (double d : numbers) sum += d;
        double mean = sum / n;

        profile.setMinValue(String.valueOf(numbers[0]));
        profile.setMaxValue(String.valueOf(numbers[n - 1]));
        profile.setMeanValue(mean);
        profile.setMedianValue(n % 2 == 1 ? numbers[n / 2] : (numbers[n / 2 - 1] + numbers[n / 2]) / 2.0);

        // 样本标准差，少于两个值时无定义
        if (n > 1) {
            double squares = 0;
            for (double d : numbers) squares += (d - mean) * (d - mean);
            profile.setStdDev(Math.sqrt(squares / (n - 1)));
        }
    }
}
