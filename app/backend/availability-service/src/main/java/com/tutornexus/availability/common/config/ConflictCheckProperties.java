package com.tutornexus.availability.common.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Conflict check settings (application.yml conflict-check.*)
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "conflict-check")
public class ConflictCheckProperties {

    /**
     * Upper bound for one candidate fetch. A fetch that exceeds it fails the whole check.
     */
    @NotNull
    private Duration timeout = Duration.ofSeconds(5);

    /**
     * Worker threads for candidate fetches
     */
    @Min(1)
    private int poolSize = 4;

    @Min(1)
    private int queueCapacity = 100;
}
