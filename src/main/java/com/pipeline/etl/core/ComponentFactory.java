package com.pipeline.etl.core;

import com.pipeline.etl.model.ComponentConfig;

/**
 * 组件工厂接口，把组件配置解析为对应角色的能力实现。
 *
 * 每种角色支持的组件种类是封闭集合，未知种类、角色不匹配或缺少必需参数
 * 都在构造阶段抛出ConfigurationException，而不是等到运行时才失败。
 */
public interface ComponentFactory {

    /**
     * @param config       组件配置
     * @param pipelineName 所属管道名称，部分组件用于记录质量指标
     * @throws com.pipeline.etl.exception.ConfigurationException 配置不合法时抛出
     */
    Extractor createExtractor(ComponentConfig config, String pipelineName);

    Transformer createTransformer(ComponentConfig config, String pipelineName);

    Loader createLoader(ComponentConfig config, String pipelineName);
}
