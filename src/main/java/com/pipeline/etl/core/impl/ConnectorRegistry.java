package com.pipeline.etl.core.impl;

import com.pipeline.etl.core.Extractor;
import com.pipeline.etl.core.Loader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 外部连接器注册表。
 * 文件、数据库、API等具体连接器由宿主程序按名称注册，
 * 管道配置中的ConnectorExtractor / ConnectorLoader按名称引用。
 */
public class ConnectorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectorRegistry.class);

    private final ConcurrentHashMap<String, Extractor> sources = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Loader> sinks = new ConcurrentHashMap<>();

    public void registerSource(String name, Extractor source) {
        validateName(name);
        if (source == null) {
            throw new IllegalArgumentException("Source connector must not be null: " + name);
        }
        Extractor previous = sources.put(name, source);
        if (previous != null) {
            log.warn("Source connector '{}' replaced.", name);
        } else {
            log.info("Source connector '{}' registered.", name);
        }
    }

    public void registerSink(String name, Loader sink) {
        validateName(name);
        if (sink == null) {
            throw new IllegalArgumentException("Sink connector must not be null: " + name);
        }
        Loader previous = sinks.put(name, sink);
        if (previous != null) {
            log.warn("Sink connector '{}' replaced.", name);
        } else {
            log.info("Sink connector '{}' registered.", name);
        }
    }

    public boolean unregister(String name) {
        boolean removed = sources.remove(name) != null;
        removed |= sinks.remove(name) != null;
        if (removed) {
            log.info("Connector '{}' unregistered.", name);
        }
        return removed;
    }

    /** @return 未注册时返回null */
    public Extractor getSource(String name) {
        return name == null ? null : sources.get(name);
    }

    /** @return 未注册时返回null */
    public Loader getSink(String name) {
        return name == null ? null : sinks.get(name);
    }

    public Set<String> getSourceNames() {
        return Set.copyOf(sources.keySet());
    }

    public Set<String> getSinkNames() {
        return Set.copyOf(sinks.keySet());
    }

    private void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Connector name must not be null or blank");
        }
    }
}
