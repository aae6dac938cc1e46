package com.pipeline.etl;

import com.pipeline.etl.core.PipelineScheduler;
import com.pipeline.etl.core.impl.*;
import com.pipeline.etl.storage.SQLitePipelineStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;

/**
 * 系统启动引导类。
 * 一条命令完成全部初始化：创建存储、质量监控、组件工厂，加载调度注册表并启动调度。
 *
 * 连接器由宿主在start之前注册到{@link #getConnectorRegistry()}。
 *
 * 用法：java -jar pipeline-etl.jar [配置文件路径]
 */
public class EtlApplication {

    private static final Logger log = LoggerFactory.getLogger(EtlApplication.class);

    private final ConnectorRegistry connectorRegistry = new ConnectorRegistry();
    private SQLitePipelineStore store;
    private DefaultQualityMonitor qualityMonitor;
    private PipelineScheduler scheduler;
    private final CountDownLatch terminated = new CountDownLatch(1);

    public void start(AppConfig config) {
        log.info("=== ETL Pipeline Platform ===");
        log.info("Starting with config: {}", config);
        Clock clock = Clock.systemDefaultZone();

        // 1. 初始化存储层
        store = new SQLitePipelineStore(config.getDbPath(), clock);

        // 2. 初始化质量监控
        qualityMonitor = new DefaultQualityMonitor(
                store,
                config.toQualityThresholds(),
                config.getHealthWindow(),
                config.getReportDays(),
                clock
        );

        // 3. 初始化组件工厂
        DefaultComponentFactory componentFactory =
                new DefaultComponentFactory(connectorRegistry, qualityMonitor, clock);

        // 4. 初始化执行器与调度器
        PipelineRunner runner = new PipelineRunner(
                config.getWorkerParallelism(),
                config.getExecutionTimeoutMs()
        );
        scheduler = new DefaultPipelineScheduler(
                new ScheduleConfigRepository(Paths.get(config.getScheduleConfigFile())),
                componentFactory,
                store,
                qualityMonitor,
                runner,
                config.getTickIntervalMs(),
                config.getShutdownTimeoutMs(),
                clock
        );

        // 注册JVM关闭钩子
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown hook triggered, performing graceful shutdown...");
            shutdown();
        }, "shutdown-hook"));

        scheduler.start();

        log.info("=== Platform started successfully. {} scheduled pipelines ===",
                scheduler.getAllPipelineStatus().size());
    }

    public synchronized void shutdown() {
        if (scheduler != null) {
            scheduler.shutdown();
            scheduler = null;
        }
        if (store != null) {
            store.close();
            store = null;
        }
        terminated.countDown();
        log.info("=== Platform shut down ===");
    }

    /**
     * 阻塞直到shutdown完成。调度线程均为守护线程，入口线程需要在此等待。
     */
    public void awaitTermination() throws InterruptedException {
        terminated.await();
    }

    public ConnectorRegistry getConnectorRegistry() { return connectorRegistry; }
    public PipelineScheduler getScheduler() { return scheduler; }
    public DefaultQualityMonitor getQualityMonitor() { return qualityMonitor; }

    /**
     * 应用入口
     */
    public static void main(String[] args) throws InterruptedException {
        String configPath = (args.length > 0) ? args[0] : "config/etl.properties";

        AppConfig config = AppConfig.load(configPath);
        EtlApplication app = new EtlApplication();
        app.start(config);
        app.awaitTermination();
    }
}
