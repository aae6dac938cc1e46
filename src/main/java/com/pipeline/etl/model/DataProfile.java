package com.pipeline.etl.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 数据集画像，每次运行重新计算并整体替换上一次的结果
 */
public class DataProfile implements Serializable {
    private final int totalRows;
    private final int totalColumns;
    private final long duplicateRows;
    private final Map<String, ColumnProfile> columns;
    private final Instant timestamp;

    public DataProfile(int totalRows, int totalColumns, long duplicateRows,
                       Map<String, ColumnProfile> columns, Instant timestamp) {
        this.totalRows = totalRows;
        this.totalColumns = totalColumns;
        this.duplicateRows = duplicateRows;
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
        this.timestamp = timestamp;
    }

    public ColumnProfile getColumn(String column) {
        return columns.get(column);
    }

    public int getTotalRows() { return totalRows; }
    public int getTotalColumns() { return totalColumns; }
    public long getDuplicateRows() { return duplicateRows; }
    public Map<String, ColumnProfile> getColumns() { return columns; }
    public Instant getTimestamp() { return timestamp; }
}
