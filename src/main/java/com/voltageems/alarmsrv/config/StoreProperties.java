package com.voltageems.alarmsrv.config;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DurationUnit;

/**
 * Settings of the rule store file.
 *
 * @param path SQLite file; missing parent directories are created
 * @param busyTimeout how long a statement waits for a competing writer before failing;
 *     bare numbers are seconds
 * @param maxPoolSize connections kept open against the file
 */
@ConfigurationProperties(prefix = "alarm.store")
public record StoreProperties(
    @DefaultValue("data/voltageems-alarm.db") String path,
    @DefaultValue("30s") @DurationUnit(ChronoUnit.SECONDS) Duration busyTimeout,
    @DefaultValue("4") int maxPoolSize
) {}
