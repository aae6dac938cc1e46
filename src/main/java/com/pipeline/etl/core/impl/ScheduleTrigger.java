package com.pipeline.etl.core.impl;

import com.pipeline.etl.model.ScheduleSpec;
import com.pipeline.etl.model.ScheduleType;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * 单个调度管道的触发器，根据调度规则计算下一次触发时间。
 * 只由调度线程访问。
 */
public class ScheduleTrigger {

    private final ScheduleSpec spec;
    private final ZoneId zone;
    private Instant nextRun;

    /**
     * @param now 注册时刻；间隔型触发器从此刻起算
     * @throws IllegalArgumentException 调度规则不受支持（cron）
     */
    public ScheduleTrigger(ScheduleSpec spec, ZoneId zone, Instant now) {
        if (!isSupported(spec)) {
            throw new IllegalArgumentException("Unsupported schedule type: " + spec.getType());
        }
        spec.validate();
        this.spec = spec;
        this.zone = zone;
        this.nextRun = computeNext(now);
    }

    public static boolean isSupported(ScheduleSpec spec) {
        return spec != null && spec.getType() != null && spec.getType() != ScheduleType.CRON;
    }

    public boolean isDue(Instant now) {
        return !now.isBefore(nextRun);
    }

    /**
     * 触发后推进到下一次触发时间
     */
    public void advance(Instant now) {
        this.nextRun = computeNext(now);
    }

    /**
     * 严格晚于from的下一次触发时间
     */
    public Instant computeNext(Instant from) {
        switch (spec.getType()) {
            case INTERVAL:
                return from.plus(Duration.ofMinutes(spec.getIntervalMinutesOrDefault()));
            case DAILY: {
                ZonedDateTime current = from.atZone(zone);
                ZonedDateTime candidate = current.with(spec.getLocalTime()).truncatedTo(ChronoUnit.MINUTES);
                if (!candidate.isAfter(current)) {
                    candidate = candidate.plusDays(1);
                }
                return candidate.toInstant();
            }
            case WEEKLY: {
                ZonedDateTime current = from.atZone(zone);
                ZonedDateTime candidate = current.with(TemporalAdjusters.nextOrSame(spec.getDayOfWeek()))
                        .with(spec.getLocalTime())
                        .truncatedTo(ChronoUnit.MINUTES);
                if (!candidate.isAfter(current)) {
                    candidate = candidate.plusWeeks(1);
                }
                return candidate.toInstant();
            }
            default:
                throw new IllegalStateException("Unsupported schedule type: " + spec.getType());
        }
    }

    public Instant getNextRun() { return nextRun; }
    public ScheduleSpec getSpec() { return spec; }
}
