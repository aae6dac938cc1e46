package com.pipeline.etl.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 内存表格数据集，在管道各阶段之间传递。
 * 列有序；每行是列名到值的映射，缺失的列值为null。
 * 可为列显式声明类型，未声明的列按值推断。
 */
public class Dataset implements Serializable {

    private final List<String> columns;
    private final Map<String, ColumnType> declaredTypes;
    private final List<Map<String, Object>> rows;

    public Dataset(List<String> columns) {
        this(columns, Collections.emptyMap());
    }

    public Dataset(List<String> columns, Map<String, ColumnType> declaredTypes) {
        Objects.requireNonNull(columns, "columns must not be null");
        this.columns = new ArrayList<>(new LinkedHashSet<>(columns));
        this.declaredTypes = new LinkedHashMap<>();
        if (declaredTypes != null) {
            declaredTypes.forEach((col, type) -> {
                if (this.columns.contains(col)) this.declaredTypes.put(col, type);
            });
        }
        this.rows = new ArrayList<>();
    }

    /**
     * 以行集合构建数据集，列顺序取各行键的首次出现顺序
     */
    public static Dataset fromRows(List<? extends Map<String, ?>> rows) {
        Set<String> cols = new LinkedHashSet<>();
        for (Map<String, ?> row : rows) {
            cols.addAll(row.keySet());
        }
        Dataset dataset = new Dataset(new ArrayList<>(cols));
        for (Map<String, ?> row : rows) {
            dataset.addRow(row);
        }
        return dataset;
    }

    public static Dataset empty() {
        return new Dataset(Collections.emptyList());
    }

    /**
     * 追加一行；不属于本数据集的列被忽略
     */
    public void addRow(Map<String, ?> values) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (String col : columns) {
            row.put(col, values == null ? null : values.get(col));
        }
        rows.add(row);
    }

    public void declareType(String column, ColumnType type) {
        if (!columns.contains(column)) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        declaredTypes.put(column, type);
    }

    public List<String> getColumns() {
        return Collections.unmodifiableList(columns);
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    /**
     * 只读行视图，修改值需通过 setValue
     */
    public List<Map<String, Object>> getRows() {
        List<Map<String, Object>> views = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            views.add(Collections.unmodifiableMap(row));
        }
        return Collections.unmodifiableList(views);
    }

    public Object getValue(int rowIndex, String column) {
        return rows.get(rowIndex).get(column);
    }

    public void setValue(int rowIndex, String column, Object value) {
        if (!columns.contains(column)) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        rows.get(rowIndex).put(column, value);
    }

    public List<Object> getColumnValues(String column) {
        if (!columns.contains(column)) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(row.get(column));
        }
        return values;
    }

    /**
     * 声明类型优先，否则按列值推断
     */
    public ColumnType getColumnType(String column) {
        ColumnType declared = declaredTypes.get(column);
        return declared != null ? declared : ColumnType.infer(getColumnValues(column));
    }

    public Map<String, ColumnType> getDeclaredTypes() {
        return Collections.unmodifiableMap(declaredTypes);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int columnCount() {
        return columns.size();
    }

    public long cellCount() {
        return (long) rows.size() * columns.size();
    }

    public long nonNullCount(String column) {
        long count = 0;
        for (Map<String, Object> row : rows) {
            if (row.get(column) != null) count++;
        }
        return count;
    }

    public long nonNullCellCount() {
        long count = 0;
        for (String col : columns) {
            count += nonNullCount(col);
        }
        return count;
    }

    /**
     * 与之前某一行完全相同的行数（首次出现的行不计入）
     */
    public long duplicateRowCount() {
        Set<List<Object>> seen = new HashSet<>();
        long duplicates = 0;
        for (Map<String, Object> row : rows) {
            if (!seen.add(new ArrayList<>(row.values()))) duplicates++;
        }
        return duplicates;
    }

    /**
     * 行级深拷贝，值对象本身共享
     */
    public Dataset copy() {
        Dataset copy = new Dataset(columns, declaredTypes);
        for (Map<String, Object> row : rows) {
            copy.addRow(row);
        }
        return copy;
    }

    /**
     * 拷贝并在末尾追加一列（已存在则保留原位置），新列值为null
     */
    public Dataset withColumn(String column, ColumnType type) {
        List<String> extended = new ArrayList<>(columns);
        if (!extended.contains(column)) {
            extended.add(column);
        }
        Dataset copy = new Dataset(extended, declaredTypes);
        if (type != null) {
            copy.declaredTypes.put(column, type);
        }
        for (Map<String, Object> row : rows) {
            copy.addRow(row);
        }
        return copy;
    }

    /**
     * 以相同列结构创建空数据集
     */
    public Dataset emptyCopy() {
        return new Dataset(columns, declaredTypes);
    }

    @Override
    public String toString() {
        return "Dataset{columns=" + columns + ", rows=" + rows.size() + "}";
    }
}
