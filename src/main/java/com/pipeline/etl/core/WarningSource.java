package com.pipeline.etl.core;

import java.util.List;

/**
 * 组件在成功执行后仍可能产生非阻断的告警信息（如warning级规则失败），
 * 由组件包装器在每次执行后取走并记入组件指标。
 */
public interface WarningSource {

    /**
     * 取走并清空自上次调用以来积累的警告
     */
    List<String> drainWarnings();
}
