package com.pipeline.etl.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * 管道定义：抽取器、转换器、加载器配置与执行策略
 */
public class PipelineConfig implements Serializable {
    private List<ComponentConfig> extractors = new ArrayList<>();
    private List<ComponentConfig> transformers = new ArrayList<>();
    private List<ComponentConfig> loaders = new ArrayList<>();
    private PipelinePolicy config = new PipelinePolicy();

    public PipelineConfig() {}

    public List<ComponentConfig> getExtractors() { return extractors; }
    public void setExtractors(List<ComponentConfig> extractors) { this.extractors = extractors == null ? new ArrayList<>() : extractors; }
    public List<ComponentConfig> getTransformers() { return transformers; }
    public void setTransformers(List<ComponentConfig> transformers) { this.transformers = transformers == null ? new ArrayList<>() : transformers; }
    public List<ComponentConfig> getLoaders() { return loaders; }
    public void setLoaders(List<ComponentConfig> loaders) { this.loaders = loaders == null ? new ArrayList<>() : loaders; }
    public PipelinePolicy getConfig() { return config; }
    public void setConfig(PipelinePolicy config) { this.config = config == null ? new PipelinePolicy() : config; }
}
