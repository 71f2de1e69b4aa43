package com.tutornexus.availability.common.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class SlotStatusConverter implements AttributeConverter<SlotStatus, String> {

    @Override
    public String convertToDatabaseColumn(SlotStatus status) {
        return status == null ? null : status.getStoredValue();
    }

    @Override
    public SlotStatus convertToEntityAttribute(String dbData) {
        return SlotStatus.fromStored(dbData);
    }
}
