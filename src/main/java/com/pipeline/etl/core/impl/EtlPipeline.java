package com.pipeline.etl.core.impl;

import com.pipeline.etl.core.ComponentFactory;
import com.pipeline.etl.core.PipelineStore;
import com.pipeline.etl.exception.ConfigurationException;
import com.pipeline.etl.exception.PipelineException;
import com.pipeline.etl.exception.PipelineStoreException;
import com.pipeline.etl.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 管道编排器。
 *
 * 组件严格按顺序执行：一个抽取器，零到多个转换器，一到多个加载器。
 * 上一阶段的输出作为下一阶段的输入；所有加载器接收最后一个转换器的输出。
 *
 * 失败策略：
 * - stop_on_error=true（默认）：立即中止，执行状态为failed，原始异常抛给调用方
 * - stop_on_error=false：记录失败并继续；抽取器或转换器失败后，其下游组件全部跳过，
 *   加载器之间相互独立
 *
 * 无论成功与否，执行记录（含全部组件指标）都会持久化。
 */
public class EtlPipeline {

    private static final Logger log = LoggerFactory.getLogger(EtlPipeline.class);

    private final String name;
    private final PipelinePolicy policy;
    private final List<PipelineComponent> components;
    private final PipelineStore store;
    private final Clock clock;

    private volatile ExecutionResult lastResult;
    private volatile Dataset lastOutput;

    public EtlPipeline(String name, PipelinePolicy policy, List<PipelineComponent> components,
                       PipelineStore store, Clock clock) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Pipeline name must not be null or blank");
        }
        this.name = name;
        this.policy = policy != null ? policy : PipelinePolicy.defaults();
        this.components = List.copyOf(components);
        this.store = store;
        this.clock = clock;
        validateStructure();
    }

    /**
     * 由管道配置构建。组件配置错误在此处以ConfigurationException报告。
     */
    public static EtlPipeline fromConfig(String name, PipelineConfig config, ComponentFactory factory,
                                         PipelineStore store, Clock clock) {
        PipelinePolicy policy = config.getConfig();
        int retries = policy.getMaxRetries();
        List<PipelineComponent> components = new ArrayList<>();
        for (ComponentConfig c : config.getExtractors()) {
            components.add(PipelineComponent.extractor(componentName(c), factory.createExtractor(c, name), retries, clock));
        }
        for (ComponentConfig c : config.getTransformers()) {
            components.add(PipelineComponent.transformer(componentName(c), factory.createTransformer(c, name), retries, clock));
        }
        for (ComponentConfig c : config.getLoaders()) {
            components.add(PipelineComponent.loader(componentName(c), factory.createLoader(c, name), retries, clock));
        }
        return new EtlPipeline(name, policy, components, store, clock);
    }

    private static String componentName(ComponentConfig c) {
        return c.getName() != null && !c.getName().isBlank() ? c.getName() : c.getClassName();
    }

    /**
     * 结构校验：恰好一个抽取器且位于首位，随后是转换器，最后至少一个加载器
     */
    private void validateStructure() {
        if (components.isEmpty() || components.get(0).getRole() != ComponentRole.EXTRACTOR) {
            throw new ConfigurationException("Pipeline '" + name + "' must start with exactly one extractor");
        }
        int stage = 0;
        for (int i = 1; i < components.size(); i++) {
            ComponentRole role = components.get(i).getRole();
            if (role == ComponentRole.EXTRACTOR) {
                throw new ConfigurationException("Pipeline '" + name + "' must have exactly one extractor, found another at position " + i);
            }
            int roleStage = role == ComponentRole.TRANSFORMER ? 1 : 2;
            if (roleStage < stage) {
                throw new ConfigurationException("Pipeline '" + name + "' has transformer '"
                        + components.get(i).getName() + "' after a loader");
            }
            stage = roleStage;
        }
        if (components.get(components.size() - 1).getRole() != ComponentRole.LOADER) {
            throw new ConfigurationException("Pipeline '" + name + "' must end with at least one loader");
        }
    }

    /**
     * 执行一次管道。
     *
     * @return 执行记录
     * @throws PipelineException stop_on_error=true且某组件失败时抛出原始组件异常
     */
    public ExecutionResult execute() {
        Instant start = clock.instant();
        String executionId = HashIds.md5Hex(name + "_" + start);
        ExecutionResult result = new ExecutionResult(executionId, name);
        result.setStartTime(start);
        result.setStatus(ExecutionStatus.RUNNING);
        result.setTotalComponents(components.size());
        lastResult = result;
        lastOutput = null;

        log.info("Pipeline '{}' execution {} started with {} components.", name, executionId, components.size());

        for (PipelineComponent component : components) {
            component.reset();
        }

        Dataset current = null;
        String failedUpstream = null;
        PipelineException abort = null;

        for (PipelineComponent component : components) {
            if (failedUpstream != null) {
                component.markSkipped("Skipped because upstream component '" + failedUpstream + "' failed");
                continue;
            }
            try {
                switch (component.getRole()) {
                    case EXTRACTOR:
                        current = component.extract();
                        break;
                    case TRANSFORMER:
                        current = component.transform(current);
                        break;
                    case LOADER:
                        component.load(current);
                        break;
                    default:
                        throw new IllegalStateException("Unknown role: " + component.getRole());
                }
            } catch (PipelineException e) {
                if (result.getErrorMessage() == null) {
                    result.setErrorMessage(e.getMessage());
                }
                if (policy.isStopOnError()) {
                    abort = e;
                    break;
                }
                log.warn("Pipeline '{}': component '{}' failed, continuing (stop_on_error=false): {}",
                        name, component.getName(), e.getMessage());
                if (component.getRole() != ComponentRole.LOADER) {
                    failedUpstream = component.getName();
                    current = null;
                }
            }
        }

        lastOutput = current;
        finalizeResult(result, abort != null);

        try {
            persist(result);
        } catch (PipelineStoreException e) {
            if (abort == null) {
                throw e;
            }
            abort.addSuppressed(e);
        }

        if (abort != null) {
            log.error("Pipeline '{}' execution {} failed: {}", name, executionId, abort.getMessage());
            throw abort;
        }
        log.info("Pipeline '{}' execution {} finished with status {} in {}s ({} ok, {} failed).",
                name, executionId, result.getStatus().getValue(), String.format("%.3f", result.getDurationSeconds()),
                result.getSuccessfulComponents(), result.getFailedComponents());
        return result;
    }

    private void finalizeResult(ExecutionResult result, boolean aborted) {
        List<ComponentMetrics> metrics = new ArrayList<>();
        int successful = 0;
        int failed = 0;
        for (PipelineComponent component : components) {
            ComponentMetrics m = component.getMetrics();
            metrics.add(m);
            if (m.getStatus() == ComponentStatus.COMPLETED) {
                successful++;
            } else if (m.getStatus() == ComponentStatus.FAILED || m.getStatus() == ComponentStatus.SKIPPED) {
                failed++;
            }
        }
        Instant end = clock.instant();
        result.setEndTime(end);
        result.setDurationSeconds(Duration.between(result.getStartTime(), end).toNanos() / 1_000_000_000.0);
        result.setSuccessfulComponents(successful);
        result.setFailedComponents(failed);
        result.setComponentMetrics(metrics);
        if (aborted) {
            result.setStatus(ExecutionStatus.FAILED);
        } else if (failed > 0) {
            result.setStatus(ExecutionStatus.PARTIAL);
        } else {
            result.setStatus(ExecutionStatus.COMPLETED);
        }
    }

    private void persist(ExecutionResult result) {
        if (store == null) {
            log.debug("No store configured, execution {} not persisted.", result.getExecutionId());
            return;
        }
        store.saveExecution(result);
    }

    public String getName() { return name; }
    public PipelinePolicy getPolicy() { return policy; }
    public List<PipelineComponent> getComponents() { return Collections.unmodifiableList(components); }

    /** 最近一次执行的记录，执行中途抛出异常时也可取得 */
    public ExecutionResult getLastResult() { return lastResult; }

    /** 最近一次执行最后一个转换阶段的输出；上游失败时为null */
    public Dataset getLastOutput() { return lastOutput; }
}
