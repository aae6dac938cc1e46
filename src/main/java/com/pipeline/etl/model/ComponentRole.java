package com.pipeline.etl.model;

/**
 * 组件在管道中的角色
 */
public enum ComponentRole {
    /** 抽取：无输入，产出数据集 */
    EXTRACTOR,
    /** 转换：数据集进，数据集出 */
    TRANSFORMER,
    /** 加载：数据集进，布尔结果出 */
    LOADER
}
