package com.tutornexus.availability.rollover.service;

import lombok.Value;

@Value
public class FixedLessonResult {
    int created;
    int skipped;
}
