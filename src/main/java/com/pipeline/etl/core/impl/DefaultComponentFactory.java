package com.pipeline.etl.core.impl;

import com.pipeline.etl.components.ConnectorExtractor;
import com.pipeline.etl.components.ConnectorLoader;
import com.pipeline.etl.components.DataCleaner;
import com.pipeline.etl.components.DataEnricher;
import com.pipeline.etl.components.DataValidator;
import com.pipeline.etl.components.InlineExtractor;
import com.pipeline.etl.core.ComponentFactory;
import com.pipeline.etl.core.Extractor;
import com.pipeline.etl.core.Loader;
import com.pipeline.etl.core.QualityMonitor;
import com.pipeline.etl.core.Transformer;
import com.pipeline.etl.exception.ConfigurationException;
import com.pipeline.etl.model.ComponentConfig;
import com.pipeline.etl.model.ComponentRole;
import com.pipeline.etl.model.ConfigMaps;
import com.pipeline.etl.quality.QualityRule;
import com.pipeline.etl.quality.QualityValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;

/**
 * 组件工厂默认实现。
 * 组件种类是按角色划分的封闭集合，在构造阶段穷举匹配。
 */
public class DefaultComponentFactory implements ComponentFactory {

    private static final Logger log = LoggerFactory.getLogger(DefaultComponentFactory.class);

    /**
     * 内置组件种类
     */
    public enum ComponentKind {
        INLINE_EXTRACTOR("InlineExtractor", ComponentRole.EXTRACTOR),
        CONNECTOR_EXTRACTOR("ConnectorExtractor", ComponentRole.EXTRACTOR),
        DATA_CLEANER("DataCleaner", ComponentRole.TRANSFORMER),
        DATA_ENRICHER("DataEnricher", ComponentRole.TRANSFORMER),
        DATA_VALIDATOR("DataValidator", ComponentRole.TRANSFORMER),
        QUALITY_VALIDATOR("QualityValidator", ComponentRole.TRANSFORMER),
        CONNECTOR_LOADER("ConnectorLoader", ComponentRole.LOADER);

        private final String className;
        private final ComponentRole role;

        ComponentKind(String className, ComponentRole role) {
            this.className = className;
            this.role = role;
        }

        public String getClassName() { return className; }
        public ComponentRole getRole() { return role; }

        public static ComponentKind fromClassName(String className) {
            if (className != null) {
                for (ComponentKind kind : values()) {
                    if (kind.className.equals(className.trim())) return kind;
                }
            }
            throw new ConfigurationException("Unknown component class: " + className);
        }
    }

    private final ConnectorRegistry connectors;
    private final QualityMonitor qualityMonitor;
    private final Clock clock;

    /**
     * @param qualityMonitor 质量校验器记录指标用，可为null
     */
    public DefaultComponentFactory(ConnectorRegistry connectors, QualityMonitor qualityMonitor, Clock clock) {
        this.connectors = connectors;
        this.qualityMonitor = qualityMonitor;
        this.clock = clock;
    }

    @Override
    public Extractor createExtractor(ComponentConfig config, String pipelineName) {
        ComponentKind kind = resolve(config, ComponentRole.EXTRACTOR);
        Map<String, Object> params = config.getParams();
        String owner = describe(config);
        switch (kind) {
            case INLINE_EXTRACTOR:
                Map<String, Object> rawTypes = ConfigMaps.getMap(params, "types");
                Map<String, String> types = new LinkedHashMap<>();
                if (rawTypes != null) {
                    rawTypes.forEach((column, type) -> types.put(column, String.valueOf(type)));
                }
                return new InlineExtractor(ConfigMaps.getMapList(params, "rows", owner),
                        ConfigMaps.getStringList(params, "columns"), types);
            case CONNECTOR_EXTRACTOR:
                return new ConnectorExtractor(connectors, ConfigMaps.requireString(params, "connector", owner));
            default:
                throw new ConfigurationException("Unsupported extractor kind: " + kind);
        }
    }

    @Override
    public Transformer createTransformer(ComponentConfig config, String pipelineName) {
        ComponentKind kind = resolve(config, ComponentRole.TRANSFORMER);
        Map<String, Object> params = config.getParams();
        Map<String, Object> settings = config.getConfig();
        String owner = describe(config);
        switch (kind) {
            case DATA_CLEANER:
                return new DataCleaner(config.getName(),
                        ConfigMaps.getBoolean(settings, "auto_clean", true),
                        ConfigMaps.getMapList(settings, "cleaning_rules", owner));
            case DATA_ENRICHER:
                Map<String, List<Map<String, Object>>> lookupData = new LinkedHashMap<>();
                Map<String, Object> tables = ConfigMaps.getMap(settings, "lookup_data");
                if (tables != null) {
                    for (String table : tables.keySet()) {
                        lookupData.put(table, ConfigMaps.getMapList(tables, table, owner));
                    }
                }
                return new DataEnricher(config.getName(),
                        ConfigMaps.getMapList(params, "enrichment_rules", owner), lookupData, clock);
            case DATA_VALIDATOR:
                return new DataValidator(config.getName(),
                        ConfigMaps.getBoolean(settings, "strict_mode", false),
                        ConfigMaps.getMapList(params, "validation_rules", owner));
            case QUALITY_VALIDATOR:
                List<QualityRule> rules = new ArrayList<>();
                for (Map<String, Object> ruleConfig : ConfigMaps.getMapList(params, "rules", owner)) {
                    rules.add(QualityRule.fromConfig(ruleConfig));
                }
                return new QualityValidator(config.getName(), rules,
                        ConfigMaps.getBoolean(settings, "strict_mode", false),
                        qualityMonitor, pipelineName,
                        ConfigMaps.getString(params, "table_name", pipelineName), clock);
            default:
                throw new ConfigurationException("Unsupported transformer kind: " + kind);
        }
    }

    @Override
    public Loader createLoader(ComponentConfig config, String pipelineName) {
        ComponentKind kind = resolve(config, ComponentRole.LOADER);
        String owner = describe(config);
        switch (kind) {
            case CONNECTOR_LOADER:
                return new ConnectorLoader(connectors, ConfigMaps.requireString(config.getParams(), "connector", owner));
            default:
                throw new ConfigurationException("Unsupported loader kind: " + kind);
        }
    }

    private ComponentKind resolve(ComponentConfig config, ComponentRole expectedRole) {
        if (config == null) {
            throw new ConfigurationException("Component configuration must not be null");
        }
        ComponentKind kind = ComponentKind.fromClassName(config.getClassName());
        if (kind.getRole() != expectedRole) {
            throw new ConfigurationException("Component '" + config.getName() + "' of class "
                    + config.getClassName() + " is a " + kind.getRole() + ", not a " + expectedRole);
        }
        log.debug("Creating {} '{}' of class {}", expectedRole, config.getName(), kind.getClassName());
        return kind;
    }

    private static String describe(ComponentConfig config) {
        return "component '" + config.getName() + "' (" + config.getClassName() + ")";
    }
}
