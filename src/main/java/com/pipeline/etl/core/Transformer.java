package com.pipeline.etl.core;

import com.pipeline.etl.model.Dataset;

/**
 * 转换能力：接收上一阶段的数据集并返回新的数据集。
 * 对同一输入应当是确定且幂等的，重试才是安全的。
 */
@FunctionalInterface
public interface Transformer {

    Dataset transform(Dataset data) throws Exception;
}
