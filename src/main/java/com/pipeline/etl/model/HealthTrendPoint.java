package com.pipeline.etl.model;

import java.time.LocalDate;

/**
 * 健康分按天聚合的趋势点
 */
public class HealthTrendPoint {
    private final LocalDate date;
    private final double avgHealthScore;

    public HealthTrendPoint(LocalDate date, double avgHealthScore) {
        this.date = date;
        this.avgHealthScore = avgHealthScore;
    }

    public LocalDate getDate() { return date; }
    public double getAvgHealthScore() { return avgHealthScore; }

    @Override
    public String toString() {
        return date + "=" + String.format("%.3f", avgHealthScore);
    }
}
