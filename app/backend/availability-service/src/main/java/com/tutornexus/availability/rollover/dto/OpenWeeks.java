package com.tutornexus.availability.rollover.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.time.LocalDate;

/**
 * The two bookable weeks, each identified by its Sunday
 */
@Value
public class OpenWeeks {
    LocalDate currentWeek;
    LocalDate nextWeek;

    /**
     * The week a rollover opens next
     */
    @JsonIgnore
    public LocalDate getFollowingWeek() {
        return nextWeek.plusWeeks(1);
    }
}
