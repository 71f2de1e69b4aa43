package com.tutornexus.availability.common.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class LessonStatusConverter implements AttributeConverter<LessonStatus, String> {

    @Override
    public String convertToDatabaseColumn(LessonStatus status) {
        return status == null ? null : status.getStoredValue();
    }

    @Override
    public LessonStatus convertToEntityAttribute(String dbData) {
        return LessonStatus.fromStored(dbData);
    }
}
