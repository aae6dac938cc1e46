package com.pipeline.etl.core;

import com.pipeline.etl.model.*;

import java.util.List;

/**
 * 管道调度器接口，调度注册表的唯一持有者。
 *
 * 注册表从持久化配置加载，每次修改后立即回写。后台循环按固定节拍检查
 * 已启用触发器的到期情况，到期的管道分派到工作线程执行；同名管道同一时刻
 * 至多执行一次，不同名称的管道互不阻塞。
 */
public interface PipelineScheduler {

    /**
     * 启动后台调度循环。重复调用无效果。
     */
    void start();

    /**
     * 停止调度：清空触发器，有界等待循环线程退出，正在执行的管道允许跑完。
     */
    void stop();

    /**
     * 停止调度并释放线程：有界等待进行中的执行完成后关闭工作线程和调度线程。
     * 之后调度器不可再用。
     */
    void shutdown();

    boolean isRunning();

    /**
     * 新增或替换一个调度管道并持久化。
     *
     * @throws com.pipeline.etl.exception.ConfigurationException 调度规则不合法时抛出
     */
    void addPipeline(String name, PipelineConfig pipelineConfig, ScheduleSpec schedule, boolean enabled);

    /**
     * @throws IllegalArgumentException 管道不存在时抛出
     */
    void enablePipeline(String name);

    /**
     * 禁用后不再参与触发器评估，运行计数保持不变。
     *
     * @throws IllegalArgumentException 管道不存在时抛出
     */
    void disablePipeline(String name);

    /**
     * 同步执行一次管道。
     *
     * @param manual 手动触发时忽略禁用标志
     * @return 结构化执行结果，正常情况不抛异常
     */
    ExecutionOutcome executePipeline(String name, boolean manual);

    /**
     * @return 管道状态快照；不存在时返回null
     */
    ScheduledPipeline getPipelineStatus(String name);

    List<ScheduledPipeline> getAllPipelineStatus();

    SchedulerMetricsReport getMetrics(String pipelineName, int days);
}
