package com.pipeline.etl.core;

import com.pipeline.etl.model.Dataset;

/**
 * 抽取能力：从数据源读取一个数据集。
 * 管道的第一个阶段，不接收输入。
 */
@FunctionalInterface
public interface Extractor {

    /**
     * @return 抽取得到的数据集，不应为null
     * @throws Exception 数据源不可用或读取失败
     */
    Dataset extract() throws Exception;
}
