package com.pipeline.etl.core.impl;

import com.pipeline.etl.exception.ConfigurationException;
import com.pipeline.etl.model.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleConfigRepositoryTest {

    @TempDir
    Path tempDir;

    private static ScheduledPipeline samplePipeline() {
        PipelineConfig config = new PipelineConfig();
        config.setExtractors(List.of(new ComponentConfig("seed", "InlineExtractor",
                Map.of("rows", List.of(Map.of("sku", "A-1", "qty", 3))), null)));
        config.setTransformers(List.of(new ComponentConfig("cleaner", "DataCleaner", null,
                Map.of("auto_clean", false))));
        config.setLoaders(List.of(new ComponentConfig("sink", "ConnectorLoader",
                Map.of("connector", "warehouse"), null)));
        config.getConfig().setStopOnError(false);
        config.getConfig().setMaxRetries(2);

        ScheduledPipeline pipeline = new ScheduledPipeline("inventory", config, ScheduleSpec.weekly("sunday", "03:15"), true);
        pipeline.setRunCount(4);
        pipeline.setSuccessCount(3);
        pipeline.setFailureCount(1);
        pipeline.setLastRun(Instant.parse("2024-03-03T03:15:00Z"));
        pipeline.setLastErrorMessage("sink unavailable");
        return pipeline;
    }

    private static void assertRestored(ScheduledPipeline restored) {
        assertEquals("inventory", restored.getName());
        assertTrue(restored.isEnabled());
        assertEquals(ScheduleType.WEEKLY, restored.getSchedule().getType());
        assertEquals("sunday", restored.getSchedule().getDay());
        assertEquals("03:15", restored.getSchedule().getTime());
        assertEquals(4, restored.getRunCount());
        assertEquals(3, restored.getSuccessCount());
        assertEquals(1, restored.getFailureCount());
        assertEquals(Instant.parse("2024-03-03T03:15:00Z"), restored.getLastRun());
        assertEquals("sink unavailable", restored.getLastErrorMessage());

        PipelineConfig config = restored.getPipelineConfig();
        assertEquals("InlineExtractor", config.getExtractors().get(0).getClassName());
        assertEquals("warehouse", config.getLoaders().get(0).getParams().get("connector"));
        assertEquals(Boolean.FALSE, config.getTransformers().get(0).getConfig().get("auto_clean"));
        assertFalse(config.getConfig().isStopOnError());
        assertEquals(2, config.getConfig().getMaxRetries());
    }

    @Test
    void testSaveAndLoad_json() throws Exception {
        Path file = tempDir.resolve("nested/pipeline_schedules.json");
        ScheduleConfigRepository repository = new ScheduleConfigRepository(file);

        assertTrue(repository.save(1, Map.of("inventory", samplePipeline())));

        String json = Files.readString(file);
        assertTrue(json.contains("\"class\""), json);
        assertTrue(json.contains("\"run_count\""), json);
        assertFalse(json.contains("\"name\" : \"inventory\""), "Registry key carries the pipeline name");
        assertRestored(new ScheduleConfigRepository(file).load().get("inventory"));
    }

    @Test
    void testSaveAndLoad_yaml() {
        Path file = tempDir.resolve("pipeline_schedules.yml");
        new ScheduleConfigRepository(file).save(1, Map.of("inventory", samplePipeline()));

        assertRestored(new ScheduleConfigRepository(file).load().get("inventory"));
    }

    @Test
    void testSave_staleSnapshotIgnored() {
        Path file = tempDir.resolve("pipeline_schedules.json");
        ScheduleConfigRepository repository = new ScheduleConfigRepository(file);
        Map<String, ScheduledPipeline> newer = new LinkedHashMap<>();
        newer.put("inventory", samplePipeline());
        newer.put("orders", new ScheduledPipeline("orders", new PipelineConfig(), ScheduleSpec.interval(5), false));

        assertTrue(repository.save(5, newer));
        assertFalse(repository.save(4, Map.of("inventory", samplePipeline())));
        assertFalse(repository.save(5, Map.of()));

        assertEquals(2, repository.load().size());
        assertTrue(repository.save(6, Map.of()));
        assertTrue(repository.load().isEmpty());
    }

    @Test
    void testLoad_missingFileIsEmptyRegistry() {
        assertTrue(new ScheduleConfigRepository(tempDir.resolve("absent.json")).load().isEmpty());
    }

    @Test
    void testLoad_malformedFileRejected() throws Exception {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{ \"inventory\": [ not json");

        assertThrows(ConfigurationException.class, () -> new ScheduleConfigRepository(file).load());
    }

    @Test
    void testLoad_bundledSampleRegistry() {
        Map<String, ScheduledPipeline> registry =
                new ScheduleConfigRepository(Paths.get("config/pipeline_schedules.json")).load();

        ScheduledPipeline sample = registry.get("customer_sync");
        assertNotNull(sample);
        assertFalse(sample.isEnabled());
        assertEquals(ScheduleType.DAILY, sample.getSchedule().getType());
        assertEquals(2, sample.getPipelineConfig().getTransformers().size());
    }
}
