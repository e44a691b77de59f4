package com.punchclock.backend.modules.attendance.domain;

import com.punchclock.backend.global.error.MalformedRowException;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class ClockStateConverter implements AttributeConverter<ClockState, String> {

    @Override
    public String convertToDatabaseColumn(ClockState attribute) {
        return attribute == null ? null : attribute.getCode();
    }

    @Override
    public ClockState convertToEntityAttribute(String dbData) {
        if (dbData == null) {
            return null;
        }
        try {
            return ClockState.fromCode(dbData.trim());
        } catch (IllegalArgumentException ex) {
            throw new MalformedRowException("user_states", "state=" + dbData, "unknown state code");
        }
    }
}
