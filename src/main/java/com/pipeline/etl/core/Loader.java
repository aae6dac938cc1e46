package com.pipeline.etl.core;

import com.pipeline.etl.model.Dataset;

/**
 * 加载能力：将数据集写入目标端。
 */
@FunctionalInterface
public interface Loader {

    /**
     * @param data 最后一个转换阶段的输出
     * @return 写入是否成功；返回false视为加载失败
     * @throws Exception 目标端写入失败
     */
    boolean load(Dataset data) throws Exception;
}
