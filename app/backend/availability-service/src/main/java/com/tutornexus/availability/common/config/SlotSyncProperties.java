package com.tutornexus.availability.common.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Slot sync settings (application.yml slot-sync.*)
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "slot-sync")
public class SlotSyncProperties {

    /**
     * Default horizon when a sync request does not name one
     */
    @Min(0)
    @Max(365)
    private int daysAhead = 14;

    /**
     * Run the lesson-overlap guard before opening a slot
     */
    private boolean openingGuardEnabled = true;
}
