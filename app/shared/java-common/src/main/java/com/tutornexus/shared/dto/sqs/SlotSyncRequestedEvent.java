package com.tutornexus.shared.dto.sqs;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Asks the availability service to re-sync slot inventory, typically after staff edited
 * a weekly template.
 *
 * Queue: slot-sync-requested-queue
 * Publisher: template editing flow
 * Consumer: Availability-Service (SlotSyncRequestedListener)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlotSyncRequestedEvent {

    /**
     * First day of the window (YYYY-MM-DD). Null means today.
     */
    private String startDate;

    /**
     * Window length in days. Null means the configured default.
     */
    private Integer daysAhead;

    /**
     * Restrict the sync to one teacher. Null means all teachers.
     */
    private String teacherId;
}
