package com.tutornexus.availability.common.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Weekly rollover settings (application.yml rollover.*)
 *
 * The cron expression itself is read by the scheduled job through a placeholder;
 * it is bound here so a malformed configuration fails at startup.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "rollover")
public class RolloverProperties {

    private boolean enabled = true;

    /**
     * Default: Friday 06:00
     */
    @NotBlank
    private String cron = "0 0 6 * * FRI";
}
