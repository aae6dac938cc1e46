package com.pipeline.etl.core.impl;

import com.pipeline.etl.core.Extractor;
import com.pipeline.etl.core.Loader;
import com.pipeline.etl.core.Transformer;
import com.pipeline.etl.core.WarningSource;
import com.pipeline.etl.exception.DataQualityException;
import com.pipeline.etl.exception.ExtractionException;
import com.pipeline.etl.exception.LoadException;
import com.pipeline.etl.exception.TransformationException;
import com.pipeline.etl.model.ComponentMetrics;
import com.pipeline.etl.model.ComponentRole;
import com.pipeline.etl.model.ComponentStatus;
import com.pipeline.etl.model.Dataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.ToLongFunction;

/**
 * 管道组件包装器：为抽取/转换/加载能力的每次调用记录执行指标。
 *
 * 调用前记录开始时间；成功后记录耗时和行数并标记completed；
 * 异常时把错误信息追加到组件错误列表、标记failed，并以对应角色的异常（保留原始cause）重新抛出。
 * 失败的调用按max_retries重试，每次失败都会记录。
 */
public class PipelineComponent {

    private static final Logger log = LoggerFactory.getLogger(PipelineComponent.class);

    @FunctionalInterface
    private interface Invocation<T> {
        T call() throws Exception;
    }

    private final String name;
    private final ComponentRole role;
    private final Object delegate;
    private final int maxRetries;
    private final Clock clock;
    private ComponentMetrics metrics;

    private PipelineComponent(String name, ComponentRole role, Object delegate, int maxRetries, Clock clock) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Component name must not be null or blank");
        }
        if (delegate == null) {
            throw new IllegalArgumentException("Component '" + name + "' has no implementation");
        }
        this.name = name;
        this.role = role;
        this.delegate = delegate;
        this.maxRetries = Math.max(0, maxRetries);
        this.clock = clock;
        this.metrics = new ComponentMetrics(name, role);
    }

    public static PipelineComponent extractor(String name, Extractor extractor, int maxRetries, Clock clock) {
        return new PipelineComponent(name, ComponentRole.EXTRACTOR, extractor, maxRetries, clock);
    }

    public static PipelineComponent transformer(String name, Transformer transformer, int maxRetries, Clock clock) {
        return new PipelineComponent(name, ComponentRole.TRANSFORMER, transformer, maxRetries, clock);
    }

    public static PipelineComponent loader(String name, Loader loader, int maxRetries, Clock clock) {
        return new PipelineComponent(name, ComponentRole.LOADER, loader, maxRetries, clock);
    }

    public Dataset extract() {
        requireRole(ComponentRole.EXTRACTOR);
        Extractor extractor = (Extractor) delegate;
        return invoke(() -> {
            Dataset data = extractor.extract();
            if (data == null) {
                throw new IllegalStateException("Extractor returned no dataset");
            }
            return data;
        }, Dataset::size);
    }

    public Dataset transform(Dataset input) {
        requireRole(ComponentRole.TRANSFORMER);
        Transformer transformer = (Transformer) delegate;
        return invoke(() -> {
            Dataset data = transformer.transform(input);
            if (data == null) {
                throw new IllegalStateException("Transformer returned no dataset");
            }
            return data;
        }, Dataset::size);
    }

    public boolean load(Dataset input) {
        requireRole(ComponentRole.LOADER);
        Loader loader = (Loader) delegate;
        return invoke(() -> {
            if (!loader.load(input)) {
                throw new LoadException("Loader '" + name + "' reported an unsuccessful load");
            }
            return Boolean.TRUE;
        }, ok -> input == null ? 0 : input.size());
    }

    /**
     * 上游失败时标记为跳过，组件本身不会被调用
     */
    public void markSkipped(String reason) {
        metrics.setStatus(ComponentStatus.SKIPPED);
        metrics.addWarning(reason);
        log.info("Component '{}' skipped: {}", name, reason);
    }

    /**
     * 每次管道执行前重置指标
     */
    public void reset() {
        this.metrics = new ComponentMetrics(name, role);
    }

    private <T> T invoke(Invocation<T> invocation, ToLongFunction<T> recordCounter) {
        Instant start = clock.instant();
        metrics.setStartTime(start);
        metrics.setStatus(ComponentStatus.RUNNING);
        log.debug("Component '{}' ({}) started.", name, role);

        Exception lastError = null;
        for (int attempt = 1; attempt <= maxRetries + 1; attempt++) {
            metrics.setAttempts(attempt);
            try {
                T output = invocation.call();
                collectWarnings();
                finish(start, ComponentStatus.COMPLETED);
                metrics.setRecordsProcessed(recordCounter.applyAsLong(output));
                log.info("Component '{}' completed in {}s, {} records.",
                        name, String.format("%.3f", metrics.getDuration()), metrics.getRecordsProcessed());
                return output;
            } catch (Exception e) {
                lastError = e;
                collectWarnings();
                metrics.addError(describe(e));
                if (e instanceof InterruptedException) {
                    // 执行被取消，恢复中断标志且不再重试
                    Thread.currentThread().interrupt();
                    break;
                }
                if (e instanceof DataQualityException || Thread.currentThread().isInterrupted()) {
                    break;
                }
                if (attempt <= maxRetries) {
                    log.warn("Component '{}' attempt {}/{} failed: {}, retrying.",
                            name, attempt, maxRetries + 1, e.getMessage());
                }
            }
        }

        finish(start, ComponentStatus.FAILED);
        log.error("Component '{}' failed: {}", name, describe(lastError));
        throw wrap(lastError);
    }

    private void finish(Instant start, ComponentStatus status) {
        Instant end = clock.instant();
        metrics.setEndTime(end);
        metrics.setDuration(Duration.between(start, end).toNanos() / 1_000_000_000.0);
        metrics.setStatus(status);
    }

    private void collectWarnings() {
        if (delegate instanceof WarningSource) {
            for (String warning : ((WarningSource) delegate).drainWarnings()) {
                metrics.addWarning(warning);
            }
        }
    }

    private RuntimeException wrap(Exception e) {
        // 质量异常按原类型向上传递
        if (e instanceof DataQualityException) {
            return (DataQualityException) e;
        }
        String message = role.name().charAt(0) + role.name().substring(1).toLowerCase()
                + " '" + name + "' failed: " + e.getMessage();
        switch (role) {
            case EXTRACTOR:
                return new ExtractionException(message, e);
            case TRANSFORMER:
                return new TransformationException(message, e);
            case LOADER:
            default:
                return new LoadException(message, e);
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private void requireRole(ComponentRole expected) {
        if (role != expected) {
            throw new IllegalStateException("Component '" + name + "' is a " + role + ", not a " + expected);
        }
    }

    public String getName() { return name; }
    public ComponentRole getRole() { return role; }
    public int getMaxRetries() { return maxRetries; }

    /** 当前指标的副本 */
    public ComponentMetrics getMetrics() { return metrics.copy(); }

    Object getDelegate() { return delegate; }
}
