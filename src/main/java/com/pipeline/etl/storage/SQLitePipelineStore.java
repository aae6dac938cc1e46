package com.pipeline.etl.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pipeline.etl.core.PipelineStore;
import com.pipeline.etl.exception.PipelineStoreException;
import com.pipeline.etl.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.sql.*;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 基于SQLite的监控存储实现。
 *
 * 核心设计：
 * - 单文件数据库，WAL日志模式
 * - 单连接 + 存储级互斥锁，保证多个执行线程并发写入安全
 * - 时间戳统一存为epoch毫秒
 * - 告警按确定性id insert-or-replace，重复评估不会产生重复告警
 */
public class SQLitePipelineStore implements PipelineStore {

    private static final Logger log = LoggerFactory.getLogger(SQLitePipelineStore.class);

    private static final TypeReference<List<ComponentMetrics>> COMPONENT_METRICS_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<String>> STRING_LIST_TYPE = new TypeReference<>() {};

    private final String dbPath;
    private final Connection connection;
    private final ReentrantLock lock = new ReentrantLock();
    private final ObjectMapper mapper;
    /** 存储自身生成的时间戳（调度事件）取自此时钟 */
    private final Clock clock;

    public SQLitePipelineStore(String dbPath) {
        this(dbPath, Clock.systemUTC());
    }

    public SQLitePipelineStore(String dbPath, Clock clock) {
        this.dbPath = dbPath;
        this.clock = clock;

        File parent = new File(dbPath).getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            throw new PipelineStoreException("Failed to create storage directory: " + parent, null);
        }

        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        try {
            this.connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            initSchema();
        } catch (SQLException e) {
            log.error("Failed to open monitoring database '{}': {}", dbPath, e.getMessage(), e);
            throw new PipelineStoreException("Failed to open monitoring database: " + dbPath, e);
        }
        log.info("SQLitePipelineStore initialized. Path: {}", dbPath);
    }

    private void initSchema() throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("PRAGMA journal_mode=WAL");
            stmt.execute("PRAGMA synchronous=NORMAL");

            stmt.execute("CREATE TABLE IF NOT EXISTS executions ("
                    + "execution_id TEXT PRIMARY KEY, "
                    + "pipeline_name TEXT NOT NULL, "
                    + "start_time INTEGER NOT NULL, "
                    + "end_time INTEGER, "
                    + "status TEXT NOT NULL, "
                    + "duration_seconds REAL, "
                    + "total_components INTEGER, "
                    + "successful_components INTEGER, "
                    + "failed_components INTEGER, "
                    + "records_processed INTEGER, "
                    + "error_message TEXT, "
                    + "component_metrics TEXT)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_executions_pipeline ON executions(pipeline_name, start_time)");

            stmt.execute("CREATE TABLE IF NOT EXISTS quality_metrics ("
                    + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
                    + "pipeline_name TEXT, "
                    + "table_name TEXT, "
                    + "metric_name TEXT NOT NULL, "
                    + "metric_type TEXT NOT NULL, "
                    + "metric_value REAL NOT NULL, "
                    + "threshold_value REAL, "
                    + "status TEXT NOT NULL, "
                    + "message TEXT, "
                    + "timestamp INTEGER NOT NULL)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_quality_metrics_time ON quality_metrics(timestamp)");

            stmt.execute("CREATE TABLE IF NOT EXISTS alerts ("
                    + "id TEXT PRIMARY KEY, "
                    + "level TEXT NOT NULL, "
                    + "title TEXT NOT NULL, "
                    + "message TEXT, "
                    + "pipeline_name TEXT, "
                    + "metric_name TEXT, "
                    + "threshold_value REAL, "
                    + "actual_value REAL, "
                    + "timestamp INTEGER NOT NULL, "
                    + "acknowledged INTEGER NOT NULL DEFAULT 0, "
                    + "acknowledged_at INTEGER, "
                    + "acknowledged_by TEXT)");

            stmt.execute("CREATE TABLE IF NOT EXISTS data_profiles ("
                    + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
                    + "pipeline_name TEXT, "
                    + "table_name TEXT, "
                    + "column_name TEXT NOT NULL, "
                    + "data_type TEXT, "
                    + "total_rows INTEGER, "
                    + "duplicate_rows INTEGER, "
                    + "null_count INTEGER, "
                    + "null_percentage REAL, "
                    + "unique_count INTEGER, "
                    + "unique_percentage REAL, "
                    + "min_value TEXT, "
                    + "max_value TEXT, "
                    + "mean_value REAL, "
                    + "median_value REAL, "
                    + "std_dev REAL, "
                    + "sample_values TEXT, "
                    + "timestamp INTEGER NOT NULL)");

            stmt.execute("CREATE TABLE IF NOT EXISTS pipeline_health ("
                    + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
                    + "pipeline_name TEXT NOT NULL, "
                    + "execution_id TEXT, "
                    + "health_score REAL NOT NULL, "
                    + "timestamp INTEGER NOT NULL)");

            stmt.execute("CREATE TABLE IF NOT EXISTS pipeline_metrics ("
                    + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
                    + "pipeline_name TEXT NOT NULL, "
                    + "metric_name TEXT NOT NULL, "
                    + "metric_value REAL NOT NULL, "
                    + "timestamp INTEGER NOT NULL)");

            stmt.execute("CREATE TABLE IF NOT EXISTS scheduler_events ("
                    + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
                    + "event_type TEXT NOT NULL, "
                    + "pipeline_name TEXT, "
                    + "message TEXT, "
                    + "details TEXT, "
                    + "timestamp INTEGER NOT NULL)");
        }
    }

    // ==================== 执行记录 ====================

    @Override
    public void saveExecution(ExecutionResult result) {
        String sql = "INSERT OR REPLACE INTO executions (execution_id, pipeline_name, start_time, end_time, "
                + "status, duration_seconds, total_components, successful_components, failed_components, "
                + "records_processed, error_message, component_metrics) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        lock.lock();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, result.getExecutionId());
            stmt.setString(2, result.getPipelineName());
            stmt.setLong(3, toMillis(result.getStartTime()));
            setNullableMillis(stmt, 4, result.getEndTime());
            stmt.setString(5, result.getStatus().getValue());
            stmt.setDouble(6, result.getDurationSeconds());
            stmt.setInt(7, result.getTotalComponents());
            stmt.setInt(8, result.getSuccessfulComponents());
            stmt.setInt(9, result.getFailedComponents());
            stmt.setLong(10, result.getTotalRecordsProcessed());
            stmt.setString(11, result.getErrorMessage());
            stmt.setString(12, toJson(result.getComponentMetrics()));
            stmt.executeUpdate();
            log.debug("Execution '{}' of pipeline '{}' saved.", result.getExecutionId(), result.getPipelineName());
        } catch (SQLException e) {
            throw storeFailure("save execution " + result.getExecutionId(), e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ExecutionResult> getExecutions(String pipelineName, Instant since) {
        StringBuilder sql = new StringBuilder("SELECT * FROM executions WHERE start_time >= ?");
        if (pipelineName != null) sql.append(" AND pipeline_name = ?");
        sql.append(" ORDER BY start_time DESC");

        lock.lock();
        try (PreparedStatement stmt = connection.prepareStatement(sql.toString())) {
            stmt.setLong(1, toMillis(since));
            if (pipelineName != null) stmt.setString(2, pipelineName);
            List<ExecutionResult> results = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    results.add(mapExecution(rs));
                }
            }
            return results;
        } catch (SQLException e) {
            throw storeFailure("query executions", e);
        } finally {
            lock.unlock();
        }
    }

    private ExecutionResult mapExecution(ResultSet rs) throws SQLException {
        ExecutionResult result = new ExecutionResult(rs.getString("execution_id"), rs.getString("pipeline_name"));
        result.setStartTime(Instant.ofEpochMilli(rs.getLong("start_time")));
        long end = rs.getLong("end_time");
        if (!rs.wasNull()) result.setEndTime(Instant.ofEpochMilli(end));
        result.setStatus(ExecutionStatus.fromValue(rs.getString("status")));
        result.setDurationSeconds(rs.getDouble("duration_seconds"));
        result.setTotalComponents(rs.getInt("total_components"));
        result.setSuccessfulComponents(rs.getInt("successful_components"));
        result.setFailedComponents(rs.getInt("failed_components"));
        result.setErrorMessage(rs.getString("error_message"));
        String metricsJson = rs.getString("component_metrics");
        if (metricsJson != null) {
            result.setComponentMetrics(fromJson(metricsJson, COMPONENT_METRICS_TYPE));
        }
        return result;
    }

    // ==================== 质量指标与告警 ====================

    @Override
    public void saveQualityMetrics(List<QualityMetric> metrics) {
        if (metrics.isEmpty()) return;
        String sql = "INSERT INTO quality_metrics (pipeline_name, table_name, metric_name, metric_type, "
                + "metric_value, threshold_value, status, message, timestamp) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";
        lock.lock();
        try {
            connection.setAutoCommit(false);
            try (PreparedStatement stmt = connection.prepareStatement(sql)) {
                for (QualityMetric metric : metrics) {
                    stmt.setString(1, metric.getPipelineName());
                    stmt.setString(2, metric.getTableName());
                    stmt.setString(3, metric.getName());
                    stmt.setString(4, metric.getMetricType().getValue());
                    stmt.setDouble(5, metric.getValue());
                    stmt.setDouble(6, metric.getThreshold());
                    stmt.setString(7, metric.getStatus().getValue());
                    stmt.setString(8, metric.getMessage());
                    stmt.setLong(9, toMillis(metric.getTimestamp()));
                    stmt.addBatch();
                }
                stmt.executeBatch();
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
            log.debug("Saved {} quality metrics.", metrics.size());
        } catch (SQLException e) {
            throw storeFailure("save quality metrics", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<QualityMetric> getQualityMetrics(String pipelineName, Instant since) {
        StringBuilder sql = new StringBuilder("SELECT * FROM quality_metrics WHERE timestamp >= ?");
        if (pipelineName != null) sql.append(" AND pipeline_name = ?");
        sql.append(" ORDER BY timestamp ASC, id ASC");

        lock.lock();
        try (PreparedStatement stmt = connection.prepareStatement(sql.toString())) {
            stmt.setLong(1, toMillis(since));
            if (pipelineName != null) stmt.setString(2, pipelineName);
            List<QualityMetric> metrics = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    metrics.add(new QualityMetric(
                            rs.getString("pipeline_name"),
                            rs.getString("table_name"),
                            rs.getString("metric_name"),
                            rs.getDouble("metric_value"),
                            rs.getDouble("threshold_value"),
                            MetricType.fromValue(rs.getString("metric_type")),
                            MetricStatus.fromValue(rs.getString("status")),
                            rs.getString("message"),
                            Instant.ofEpochMilli(rs.getLong("timestamp"))));
                }
            }
            return metrics;
        } catch (SQLException e) {
            throw storeFailure("query quality metrics", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void saveAlert(Alert alert) {
        String sql = "INSERT OR REPLACE INTO alerts (id, level, title, message, pipeline_name, metric_name, "
                + "threshold_value, actual_value, timestamp, acknowledged, acknowledged_at, acknowledged_by) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        lock.lock();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, alert.getId());
            stmt.setString(2, alert.getLevel().getValue());
            stmt.setString(3, alert.getTitle());
            stmt.setString(4, alert.getMessage());
            stmt.setString(5, alert.getPipelineName());
            stmt.setString(6, alert.getMetricName());
            stmt.setDouble(7, alert.getThreshold());
            stmt.setDouble(8, alert.getActualValue());
            stmt.setLong(9, toMillis(alert.getTimestamp()));
            stmt.setInt(10, alert.isAcknowledged() ? 1 : 0);
            setNullableMillis(stmt, 11, alert.getAcknowledgedAt());
            stmt.setString(12, alert.getAcknowledgedBy());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw storeFailure("save alert " + alert.getId(), e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Alert getAlert(String alertId) {
        lock.lock();
        try (PreparedStatement stmt = connection.prepareStatement("SELECT * FROM alerts WHERE id = ?")) {
            stmt.setString(1, alertId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? mapAlert(rs) : null;
            }
        } catch (SQLException e) {
            throw storeFailure("query alert " + alertId, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Alert> getAlerts(Boolean acknowledged, AlertLevel level, int limit) {
        StringBuilder sql = new StringBuilder("SELECT * FROM alerts WHERE 1=1");
        if (acknowledged != null) sql.append(" AND acknowledged = ?");
        if (level != null) sql.append(" AND level = ?");
        sql.append(" ORDER BY timestamp DESC LIMIT ?");

        lock.lock();
        try (PreparedStatement stmt = connection.prepareStatement(sql.toString())) {
            int idx = 1;
            if (acknowledged != null) stmt.setInt(idx++, acknowledged ? 1 : 0);
            if (level != null) stmt.setString(idx++, level.getValue());
            stmt.setInt(idx, limit);
            List<Alert> alerts = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    alerts.add(mapAlert(rs));
                }
            }
            return alerts;
        } catch (SQLException e) {
            throw storeFailure("query alerts", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean acknowledgeAlert(String alertId, String acknowledgedBy, Instant acknowledgedAt) {
        String sql = "UPDATE alerts SET acknowledged = 1, acknowledged_at = ?, acknowledged_by = ? WHERE id = ?";
        lock.lock();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, toMillis(acknowledgedAt));
            stmt.setString(2, acknowledgedBy);
            stmt.setString(3, alertId);
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw storeFailure("acknowledge alert " + alertId, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<AlertLevel, Long> countActiveAlertsByLevel(Instant since) {
        String sql = "SELECT level, COUNT(*) AS cnt FROM alerts WHERE acknowledged = 0 AND timestamp >= ? GROUP BY level";
        lock.lock();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, toMillis(since));
            Map<AlertLevel, Long> counts = new EnumMap<>(AlertLevel.class);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    counts.put(AlertLevel.fromValue(rs.getString("level")), rs.getLong("cnt"));
                }
            }
            return counts;
        } catch (SQLException e) {
            throw storeFailure("count active alerts", e);
        } finally {
            lock.unlock();
        }
    }

    private Alert mapAlert(ResultSet rs) throws SQLException {
        Alert alert = new Alert(
                rs.getString("id"),
                AlertLevel.fromValue(rs.getString("level")),
                rs.getString("title"),
                rs.getString("message"),
                rs.getString("pipeline_name"),
                rs.getString("metric_name"),
                rs.getDouble("threshold_value"),
                rs.getDouble("actual_value"),
                Instant.ofEpochMilli(rs.getLong("timestamp")));
        if (rs.getInt("acknowledged") == 1) {
            long at = rs.getLong("acknowledged_at");
            alert.acknowledge(rs.getString("acknowledged_by"), rs.wasNull() ? null : Instant.ofEpochMilli(at));
        }
        return alert;
    }

    // ==================== 数据画像与健康分 ====================

    @Override
    public void saveDataProfile(String pipelineName, String tableName, DataProfile profile) {
        String sql = "INSERT INTO data_profiles (pipeline_name, table_name, column_name, data_type, total_rows, "
                + "duplicate_rows, null_count, null_percentage, unique_count, unique_percentage, min_value, "
                + "max_value, mean_value, median_value, std_dev, sample_values, timestamp) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        lock.lock();
        try {
            connection.setAutoCommit(false);
            try (PreparedStatement stmt = connection.prepareStatement(sql)) {
                for (ColumnProfile column : profile.getColumns().values()) {
                    stmt.setString(1, pipelineName);
                    stmt.setString(2, tableName);
                    stmt.setString(3, column.getColumnName());
                    stmt.setString(4, column.getDataType() != null ? column.getDataType().name() : null);
                    stmt.setInt(5, profile.getTotalRows());
                    stmt.setLong(6, profile.getDuplicateRows());
                    stmt.setLong(7, column.getNullCount());
                    stmt.setDouble(8, column.getNullPercentage());
                    stmt.setLong(9, column.getUniqueCount());
                    stmt.setDouble(10, column.getUniquePercentage());
                    stmt.setString(11, column.getMinValue());
                    stmt.setString(12, column.getMaxValue());
                    setNullableDouble(stmt, 13, column.getMeanValue());
                    setNullableDouble(stmt, 14, column.getMedianValue());
                    setNullableDouble(stmt, 15, column.getStdDev());
                    stmt.setString(16, toJson(column.getSampleValues()));
                    stmt.setLong(17, toMillis(profile.getTimestamp()));
                    stmt.addBatch();
                }
                stmt.executeBatch();
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw storeFailure("save data profile for " + pipelineName + "/" + tableName, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public DataProfile getLatestDataProfile(String pipelineName, String tableName) {
        String latestSql = "SELECT MAX(timestamp) FROM data_profiles WHERE pipeline_name = ? AND table_name = ?";
        String rowsSql = "SELECT * FROM data_profiles WHERE pipeline_name = ? AND table_name = ? AND timestamp = ? "
                + "ORDER BY id ASC";
        lock.lock();
        try {
            long latest;
            try (PreparedStatement stmt = connection.prepareStatement(latestSql)) {
                stmt.setString(1, pipelineName);
                stmt.setString(2, tableName);
                try (ResultSet rs = stmt.executeQuery()) {
                    if (!rs.next()) return null;
                    latest = rs.getLong(1);
                    if (rs.wasNull()) return null;
                }
            }

            Map<String, ColumnProfile> columns = new LinkedHashMap<>();
            int totalRows = 0;
            long duplicateRows = 0;
            try (PreparedStatement stmt = connection.prepareStatement(rowsSql)) {
                stmt.setString(1, pipelineName);
                stmt.setString(2, tableName);
                stmt.setLong(3, latest);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        totalRows = rs.getInt("total_rows");
                        duplicateRows = rs.getLong("duplicate_rows");
                        ColumnProfile column = mapColumnProfile(rs);
                        columns.put(column.getColumnName(), column);
                    }
                }
            }
            return new DataProfile(totalRows, columns.size(), duplicateRows, columns, Instant.ofEpochMilli(latest));
        } catch (SQLException e) {
            throw storeFailure("query data profile for " + pipelineName + "/" + tableName, e);
        } finally {
            lock.unlock();
        }
    }

    private ColumnProfile mapColumnProfile(ResultSet rs) throws SQLException {
        String dataType = rs.getString("data_type");
        ColumnProfile column = new ColumnProfile(rs.getString("column_name"),
                dataType != null ? ColumnType.valueOf(dataType) : null);
        column.setNullCount(rs.getLong("null_count"));
        column.setNullPercentage(rs.getDouble("null_percentage"));
        column.setUniqueCount(rs.getLong("unique_count"));
        column.setUniquePercentage(rs.getDouble("unique_percentage"));
        column.setMinValue(rs.getString("min_value"));
        column.setMaxValue(rs.getString("max_value"));
        column.setMeanValue(getNullableDouble(rs, "mean_value"));
        column.setMedianValue(getNullableDouble(rs, "median_value"));
        column.setStdDev(getNullableDouble(rs, "std_dev"));
        String samples = rs.getString("sample_values");
        if (samples != null) {
            column.setSampleValues(fromJson(samples, STRING_LIST_TYPE));
        }
        return column;
    }

    @Override
    public void saveHealthScore(String pipelineName, String executionId, double score, Instant timestamp) {
        String sql = "INSERT INTO pipeline_health (pipeline_name, execution_id, health_score, timestamp) "
                + "VALUES (?, ?, ?, ?)";
        lock.lock();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, pipelineName);
            stmt.setString(2, executionId);
            stmt.setDouble(3, score);
            stmt.setLong(4, toMillis(timestamp));
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw storeFailure("save health score for " + pipelineName, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<HealthTrendPoint> getHealthTrend(String pipelineName, Instant since) {
        StringBuilder sql = new StringBuilder("SELECT health_score, timestamp FROM pipeline_health WHERE timestamp >= ?");
        if (pipelineName != null) sql.append(" AND pipeline_name = ?");

        // 日期: [总分, 条数]
        Map<LocalDate, double[]> byDay = new TreeMap<>();
        lock.lock();
        try (PreparedStatement stmt = connection.prepareStatement(sql.toString())) {
            stmt.setLong(1, toMillis(since));
            if (pipelineName != null) stmt.setString(2, pipelineName);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    LocalDate day = Instant.ofEpochMilli(rs.getLong("timestamp")).atZone(ZoneOffset.UTC).toLocalDate();
                    double[] acc = byDay.computeIfAbsent(day, d -> new double[2]);
                    acc[0] += rs.getDouble("health_score");
                    acc[1] += 1;
                }
            }
        } catch (SQLException e) {
            throw storeFailure("query health trend", e);
        } finally {
            lock.unlock();
        }

        List<HealthTrendPoint> trend = new ArrayList<>();
        for (Map.Entry<LocalDate, double[]> entry : byDay.entrySet()) {
            trend.add(new HealthTrendPoint(entry.getKey(), entry.getValue()[0] / entry.getValue()[1]));
        }
        return trend;
    }

    // ==================== 调度指标与事件 ====================

    @Override
    public void savePipelineMetric(String pipelineName, String metricName, double value, Instant timestamp) {
        String sql = "INSERT INTO pipeline_metrics (pipeline_name, metric_name, metric_value, timestamp) "
                + "VALUES (?, ?, ?, ?)";
        lock.lock();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, pipelineName);
            stmt.setString(2, metricName);
            stmt.setDouble(3, value);
            stmt.setLong(4, toMillis(timestamp));
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw storeFailure("save pipeline metric " + metricName, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<String, Double> getLatestPipelineMetrics(String pipelineName) {
        String sql = "SELECT metric_name, metric_value FROM pipeline_metrics WHERE pipeline_name = ? "
                + "ORDER BY timestamp ASC, id ASC";
        lock.lock();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, pipelineName);
            Map<String, Double> latest = new LinkedHashMap<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    latest.put(rs.getString("metric_name"), rs.getDouble("metric_value"));
                }
            }
            return latest;
        } catch (SQLException e) {
            throw storeFailure("query pipeline metrics for " + pipelineName, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void logSchedulerEvent(String eventType, String pipelineName, String message, String details) {
        String sql = "INSERT INTO scheduler_events (event_type, pipeline_name, message, details, timestamp) "
                + "VALUES (?, ?, ?, ?, ?)";
        lock.lock();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, eventType);
            stmt.setString(2, pipelineName);
            stmt.setString(3, message);
            stmt.setString(4, details);
            stmt.setLong(5, clock.millis());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw storeFailure("log scheduler event " + eventType, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<SchedulerEvent> getSchedulerEvents(String pipelineName, int limit) {
        StringBuilder sql = new StringBuilder("SELECT * FROM scheduler_events");
        if (pipelineName != null) sql.append(" WHERE pipeline_name = ?");
        sql.append(" ORDER BY timestamp DESC, id DESC LIMIT ?");

        lock.lock();
        try (PreparedStatement stmt = connection.prepareStatement(sql.toString())) {
            int idx = 1;
            if (pipelineName != null) stmt.setString(idx++, pipelineName);
            stmt.setInt(idx, limit);
            List<SchedulerEvent> events = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    events.add(new SchedulerEvent(
                            rs.getString("event_type"),
                            rs.getString("pipeline_name"),
                            rs.getString("message"),
                            rs.getString("details"),
                            Instant.ofEpochMilli(rs.getLong("timestamp"))));
                }
            }
            return events;
        } catch (SQLException e) {
            throw storeFailure("query scheduler events", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (!connection.isClosed()) {
                connection.close();
            }
            log.info("SQLitePipelineStore closed. Path: {}", dbPath);
        } catch (SQLException e) {
            log.error("Error closing monitoring database '{}': {}", dbPath, e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    // ==================== 内部工具 ====================

    private PipelineStoreException storeFailure(String action, SQLException e) {
        log.error("Failed to {}: {}", action, e.getMessage(), e);
        return new PipelineStoreException("Failed to " + action, e);
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PipelineStoreException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new PipelineStoreException("Failed to deserialize stored JSON", e);
        }
    }

    private static long toMillis(Instant instant) {
        return instant.toEpochMilli();
    }

    private static void setNullableMillis(PreparedStatement stmt, int idx, Instant instant) throws SQLException {
        if (instant == null) {
            stmt.setNull(idx, Types.INTEGER);
        } else {
            stmt.setLong(idx, instant.toEpochMilli());
        }
    }

    private static void setNullableDouble(PreparedStatement stmt, int idx, Double value) throws SQLException {
        if (value == null || value.isNaN()) {
            stmt.setNull(idx, Types.REAL);
        } else {
            stmt.setDouble(idx, value);
        }
    }

    private static Double getNullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }
}
