package com.futuresdca.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Limits for the weekly-amount parameter sweep.
 *
 * <p>Properties prefix: {@code futuresdca.sweep.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "futuresdca.sweep")
@Getter
@Setter
public class SweepProperties {

    /** Grids larger than this get a wider step. */
    private int maxGridPoints = 1000;

    /** Candidates not started within this budget are skipped. */
    private Duration timeout = Duration.ofSeconds(60);

    /** Worker threads for candidate evaluation; 0 means one per available core. */
    private int workerThreads = 0;

    private int queueCapacity = 2000;
}
