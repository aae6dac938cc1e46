package com.pipeline.etl.components;

import com.pipeline.etl.core.Extractor;
import com.pipeline.etl.exception.ConfigurationException;
import com.pipeline.etl.model.ColumnType;
import com.pipeline.etl.model.Dataset;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 从配置中直接给出的行构建数据集。
 * 常用于种子数据、参考表和测试管道。每次抽取返回独立副本。
 */
public class InlineExtractor implements Extractor {

    private final Dataset template;

    /**
     * @param columns 列顺序，为空时按行中键的首次出现顺序
     * @param types   列声明类型（列名 -> INTEGER/DECIMAL/BOOLEAN/TIMESTAMP/STRING），可为空
     */
    public InlineExtractor(List<Map<String, Object>> rows, List<String> columns, Map<String, String> types) {
        Dataset dataset;
        if (columns == null || columns.isEmpty()) {
            dataset = Dataset.fromRows(rows);
        } else {
            dataset = new Dataset(new ArrayList<>(columns));
            for (Map<String, Object> row : rows) {
                dataset.addRow(row);
            }
        }
        if (types != null) {
            for (Map.Entry<String, String> entry : types.entrySet()) {
                if (!dataset.hasColumn(entry.getKey())) {
                    throw new ConfigurationException("Type declared for unknown column '" + entry.getKey() + "'");
                }
                try {
                    dataset.declareType(entry.getKey(), ColumnType.valueOf(entry.getValue().trim().toUpperCase()));
                } catch (IllegalArgumentException e) {
                    throw new ConfigurationException("Unknown column type '" + entry.getValue()
                            + "' for column '" + entry.getKey() + "'", e);
                }
            }
        }
        this.template = dataset;
    }

    public InlineExtractor(Dataset dataset) {
        this.template = dataset.copy();
    }

    @Override
    public Dataset extract() {
        return template.copy();
    }
}
