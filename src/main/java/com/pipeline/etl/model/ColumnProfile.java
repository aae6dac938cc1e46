package com.pipeline.etl.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * 单列数据画像。数值统计量仅对数值列计算，其余为null。
 */
public class ColumnProfile implements Serializable {
    private String columnName;
    private ColumnType dataType;
    private long nullCount;
    private double nullPercentage;
    private long uniqueCount;
    private double uniquePercentage;
    private String minValue;
    private String maxValue;
    private Double meanValue;
    private Double medianValue;
    private Double stdDev;
    /** 最多10个非空样本值 */
    private List<String> sampleValues = new ArrayList<>();

    public ColumnProfile() {}

    public ColumnProfile(String columnName, ColumnType dataType) {
        this.columnName = columnName;
        this.dataType = dataType;
    }

    public String getColumnName() { return columnName; }
    public void setColumnName(String columnName) { this.columnName = columnName; }
    public ColumnType getDataType() { return dataType; }
    public void setDataType(ColumnType dataType) { this.dataType = dataType; }
    public long getNullCount() { return nullCount; }
    public void setNullCount(long nullCount) { this.nullCount = nullCount; }
    public double getNullPercentage() { return nullPercentage; }
    public void setNullPercentage(double nullPercentage) { this.nullPercentage = nullPercentage; }
    public long getUniqueCount() { return uniqueCount; }
    public void setUniqueCount(long uniqueCount) { this.uniqueCount = uniqueCount; }
    public double getUniquePercentage() { return uniquePercentage; }
    public void setUniquePercentage(double uniquePercentage) { this.uniquePercentage = uniquePercentage; }
    public String getMinValue() { return minValue; }
    public void setMinValue(String minValue) { this.minValue = minValue; }
    public String getMaxValue() { return maxValue; }
    public void setMaxValue(String maxValue) { this.maxValue = maxValue; }
    public Double getMeanValue() { return meanValue; }
    public void setMeanValue(Double meanValue) { this.meanValue = meanValue; }
    public Double getMedianValue() { return medianValue; }
    public void setMedianValue(Double medianValue) { this.medianValue = medianValue; }
    public Double getStdDev() { return stdDev; }
    public void setStdDev(Double stdDev) { this.stdDev = stdDev; }
    public List<String> getSampleValues() { return sampleValues; }
    public void setSampleValues(List<String> sampleValues) { this.sampleValues = sampleValues; }
}
