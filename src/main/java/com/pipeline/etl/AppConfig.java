package com.pipeline.etl;

import com.pipeline.etl.model.QualityThresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;

/**
 * 应用配置类。
 * 对应配置文件中的系统级参数。
 */
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    static final String CLASSPATH_RESOURCE = "etl.properties";

    // ---- 存储 ----
    private String dbPath = "monitoring/pipeline_metrics.db";

    // ---- 调度 ----
    private String scheduleConfigFile = "config/pipeline_schedules.json";
    private long tickIntervalMs = 1000;
    private int workerParallelism = 4;
    private long executionTimeoutMs = 3_600_000L;
    private long shutdownTimeoutMs = 5000;

    // ---- 质量阈值 ----
    private double completenessThreshold = 0.95;
    private double accuracyThreshold = 0.98;
    private double consistencyThreshold = 0.95;
    private double validityThreshold = 0.99;
    private double uniquenessThreshold = 0.98;
    private double timelinessHours = 24;

    // ---- 质量监控 ----
    private long healthWindowHours = 24;
    private int reportDays = 7;

    /**
     * 读取配置文件；文件不存在时读取classpath中的etl.properties，都没有时使用默认值
     */
    public static AppConfig load(String configPath) {
        Properties props = new Properties();
        Path path = configPath != null ? Paths.get(configPath) : null;
        try {
            if (path != null && Files.exists(path)) {
                try (InputStream in = new FileInputStream(path.toFile())) {
                    props.load(in);
                }
                log.info("Loaded config from '{}'.", path);
            } else {
                try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream(CLASSPATH_RESOURCE)) {
                    if (in != null) {
                        props.load(in);
                        log.info("Config '{}' not found, loaded classpath resource '{}'.", configPath, CLASSPATH_RESOURCE);
                    } else {
                        log.warn("Config '{}' not found, using defaults.", configPath);
                    }
                }
            }
        } catch (IOException e) {
            log.warn("Failed to load config from {}, using defaults. Error: {}", configPath, e.getMessage());
            props.clear();
        }
        return fromProperties(props);
    }

    /**
     * @throws NumberFormatException 数值型配置项格式错误
     */
    public static AppConfig fromProperties(Properties props) {
        AppConfig config = new AppConfig();

        config.dbPath = props.getProperty("storage.db.path", config.dbPath);

        config.scheduleConfigFile = props.getProperty("scheduler.config.file", config.scheduleConfigFile);
        config.tickIntervalMs = Long.parseLong(
                props.getProperty("scheduler.tick.interval.ms", "1000"));
        config.workerParallelism = Integer.parseInt(
                props.getProperty("scheduler.worker.parallelism", "4"));
        config.executionTimeoutMs = Long.parseLong(
                props.getProperty("scheduler.execution.timeout.ms", "3600000"));
        config.shutdownTimeoutMs = Long.parseLong(
                props.getProperty("scheduler.shutdown.timeout.ms", "5000"));

        config.completenessThreshold = Double.parseDouble(
                props.getProperty("quality.threshold.completeness", "0.95"));
        config.accuracyThreshold = Double.parseDouble(
                props.getProperty("quality.threshold.accuracy", "0.98"));
        config.consistencyThreshold = Double.parseDouble(
                props.getProperty("quality.threshold.consistency", "0.95"));
        config.validityThreshold = Double.parseDouble(
                props.getProperty("quality.threshold.validity", "0.99"));
        config.uniquenessThreshold = Double.parseDouble(
                props.getProperty("quality.threshold.uniqueness", "0.98"));
        config.timelinessHours = Double.parseDouble(
                props.getProperty("quality.threshold.timeliness.hours", "24"));

        config.healthWindowHours = Long.parseLong(
                props.getProperty("quality.health.window.hours", "24"));
        config.reportDays = Integer.parseInt(
                props.getProperty("quality.report.days", "7"));
        return config;
    }

    public QualityThresholds toQualityThresholds() {
        QualityThresholds thresholds = QualityThresholds.defaults();
        thresholds.setCompleteness(completenessThreshold);
        thresholds.setAccuracy(accuracyThreshold);
        thresholds.setConsistency(consistencyThreshold);
        thresholds.setValidity(validityThreshold);
        thresholds.setUniqueness(uniquenessThreshold);
        thresholds.setTimelinessHours(timelinessHours);
        return thresholds;
    }

    // ---- Getters ----
    public String getDbPath() { return dbPath; }
    public String getScheduleConfigFile() { return scheduleConfigFile; }
    public long getTickIntervalMs() { return tickIntervalMs; }
    public int getWorkerParallelism() { return workerParallelism; }
    public long getExecutionTimeoutMs() { return executionTimeoutMs; }
    public long getShutdownTimeoutMs() { return shutdownTimeoutMs; }
    public double getCompletenessThreshold() { return completenessThreshold; }
    public double getAccuracyThreshold() { return accuracyThreshold; }
    public double getConsistencyThreshold() { return consistencyThreshold; }
    public double getValidityThreshold() { return validityThreshold; }
    public double getUniquenessThreshold() { return uniquenessThreshold; }
    public double getTimelinessHours() { return timelinessHours; }
    public Duration getHealthWindow() { return Duration.ofHours(healthWindowHours); }
    public int getReportDays() { return reportDays; }

    @Override
    public String toString() {
        return "AppConfig{db='" + dbPath + "'"
                + ", schedules='" + scheduleConfigFile + "'"
                + ", tick=" + tickIntervalMs + "ms"
                + ", parallelism=" + workerParallelism
                + ", timeout=" + executionTimeoutMs + "ms}";
    }
}
