package com.pipeline.etl.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 管道中单个组件的配置：{name, class, params, config}
 */
public class ComponentConfig implements Serializable {
    /** 组件实例名称，出现在日志和执行指标中 */
    private String name;
    /** 组件种类名称，如 InlineExtractor / DataCleaner / ConnectorLoader */
    @JsonProperty("class")
    private String className;
    /** 构造参数 */
    private Map<String, Object> params = new LinkedHashMap<>();
    /** 行为配置 */
    private Map<String, Object> config = new LinkedHashMap<>();

    public ComponentConfig() {}

    public ComponentConfig(String name, String className, Map<String, Object> params, Map<String, Object> config) {
        this.name = name;
        this.className = className;
        if (params != null) this.params = new LinkedHashMap<>(params);
        if (config != null) this.config = new LinkedHashMap<>(config);
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getClassName() { return className; }
    public void setClassName(String className) { this.className = className; }
    public Map<String, Object> getParams() { return params; }
    public void setParams(Map<String, Object> params) { this.params = params == null ? new LinkedHashMap<>() : params; }
    public Map<String, Object> getConfig() { return config; }
    public void setConfig(Map<String, Object> config) { this.config = config == null ? new LinkedHashMap<>() : config; }
}
