package com.pipeline.etl.quality;

import com.pipeline.etl.core.QualityMonitor;
import com.pipeline.etl.core.Transformer;
import com.pipeline.etl.core.WarningSource;
import com.pipeline.etl.exception.DataQualityException;
import com.pipeline.etl.model.Dataset;
import com.pipeline.etl.model.RuleResult;
import com.pipeline.etl.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 质量校验转换器。
 *
 * 按规则集评估数据集并生成数据画像，数据本身原样传给下一阶段。
 * 配置了质量监控时，规则结果和画像都会记录为质量指标；
 * 严格模式下存在未通过的error级规则则抛出DataQualityException。
 */
public class QualityValidator implements Transformer, WarningSource {

    private static final Logger log = LoggerFactory.getLogger(QualityValidator.class);

    private final String name;
    private final List<QualityRule> rules;
    private final boolean strictMode;
    private final QualityMonitor monitor;
    private final String pipelineName;
    private final String tableName;
    private final DataProfiler profiler = new DataProfiler();
    private final Clock clock;

    private final List<String> pendingWarnings = new ArrayList<>();
    private volatile ValidationResult lastResult;

    public QualityValidator(String name, List<QualityRule> rules, boolean strictMode) {
        this(name, rules, strictMode, null, null, null, Clock.systemUTC());
    }

    /**
     * @param monitor      质量监控，可为null
     * @param pipelineName 记录指标用的管道名
     * @param tableName    记录指标用的表名，null时取管道名
     */
    public QualityValidator(String name, List<QualityRule> rules, boolean strictMode,
                            QualityMonitor monitor, String pipelineName, String tableName, Clock clock) {
        this.name = name;
        this.rules = List.copyOf(rules);
        this.strictMode = strictMode;
        this.monitor = monitor;
        this.pipelineName = pipelineName;
        this.tableName = tableName != null ? tableName : pipelineName;
        this.clock = clock;
    }

    /**
     * 评估全部规则并生成数据画像，不抛出质量异常
     */
    public ValidationResult validate(Dataset data) {
        ValidationResult result = new ValidationResult();
        for (QualityRule rule : rules) {
            result.addRuleResult(rule.evaluate(data));
        }
        result.setDataProfile(profiler.profile(data, clock.instant()));
        return result;
    }

    @Override
    public Dataset transform(Dataset data) {
        ValidationResult result = validate(data);
        lastResult = result;

        if (monitor != null) {
            monitor.recordRuleResults(pipelineName, tableName, result.getRuleResults());
            monitor.recordDataProfile(pipelineName, tableName, result.getDataProfile());
        }

        log.info("Validator '{}': {}/{} rules passed, {} rows profiled.",
                name, result.getPassedRules(), result.getTotalRules(), data.size());

        if (!result.isPassed()) {
            List<String> failed = result.getRuleResults().stream()
                    .filter(RuleResult::isBlocking)
                    .map(RuleResult::getRuleName)
                    .collect(Collectors.toList());
            if (strictMode) {
                throw new DataQualityException(
                        "Data quality validation failed: " + failed.size() + " critical errors", failed);
            }
            log.warn("Validator '{}' found {} error-level failures {}, continuing (strict mode off).",
                    name, failed.size(), failed);
            synchronized (pendingWarnings) {
                pendingWarnings.addAll(result.getErrors());
            }
        }

        synchronized (pendingWarnings) {
            pendingWarnings.addAll(result.getWarnings());
        }
        return data;
    }

    @Override
    public List<String> drainWarnings() {
        synchronized (pendingWarnings) {
            List<String> drained = new ArrayList<>(pendingWarnings);
            pendingWarnings.clear();
            return drained;
        }
    }

    public ValidationResult getLastResult() { return lastResult; }
    public List<QualityRule> getRules() { return rules; }
    public boolean isStrictMode() { return strictMode; }
    public String getName() { return name; }
}
