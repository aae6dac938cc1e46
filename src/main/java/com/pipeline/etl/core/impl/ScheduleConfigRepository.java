package com.pipeline.etl.core.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pipeline.etl.exception.ConfigurationException;
import com.pipeline.etl.model.ScheduledPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 调度注册表的持久化：{名称: 调度管道} 形式的JSON文件，扩展名为.yml/.yaml时使用YAML。
 *
 * 写入先落临时文件再原子替换。快照带有序号，较旧的快照不会覆盖较新的。
 */
public class ScheduleConfigRepository {

    private static final Logger log = LoggerFactory.getLogger(ScheduleConfigRepository.class);

    private static final TypeReference<LinkedHashMap<String, ScheduledPipeline>> REGISTRY_TYPE =
            new TypeReference<>() {};

    private final Path path;
    private final ObjectMapper mapper;
    private long lastWrittenVersion = -1;

    public ScheduleConfigRepository(Path path) {
        this.path = path;
        String fileName = path.getFileName().toString().toLowerCase();
        ObjectMapper base = fileName.endsWith(".yml") || fileName.endsWith(".yaml")
                ? new ObjectMapper(new YAMLFactory())
                : new ObjectMapper();
        this.mapper = base
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * 读取注册表。文件不存在时返回空注册表。
     *
     * @throws ConfigurationException 文件无法解析
     */
    public Map<String, ScheduledPipeline> load() {
        if (!Files.exists(path)) {
            log.info("Schedule config '{}' not found, starting with an empty registry.", path);
            return new LinkedHashMap<>();
        }
        try {
            Map<String, ScheduledPipeline> registry = mapper.readValue(path.toFile(), REGISTRY_TYPE);
            if (registry == null) {
                return new LinkedHashMap<>();
            }
            registry.forEach((name, pipeline) -> pipeline.setName(name));
            log.info("Loaded {} scheduled pipelines from '{}'.", registry.size(), path);
            return registry;
        } catch (IOException e) {
            log.error("Failed to read schedule config '{}': {}", path, e.getMessage(), e);
            throw new ConfigurationException("Failed to read schedule config: " + path, e);
        }
    }

    /**
     * 写入注册表快照。
     *
     * @param version 快照序号，小于等于已写入序号的快照被忽略
     * @return 是否实际写入
     */
    public synchronized boolean save(long version, Map<String, ScheduledPipeline> snapshot) {
        if (version <= lastWrittenVersion) {
            log.debug("Skipping stale registry snapshot v{} (written v{}).", version, lastWrittenVersion);
            return false;
        }
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), snapshot);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            lastWrittenVersion = version;
            log.debug("Registry snapshot v{} written to '{}' ({} pipelines).", version, path, snapshot.size());
            return true;
        } catch (IOException e) {
            log.error("Failed to write schedule config '{}': {}", path, e.getMessage(), e);
            throw new ConfigurationException("Failed to write schedule config: " + path, e);
        }
    }

    public Path getPath() { return path; }
}
