package com.fantasyreport.collector.domain.enums;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class IngestReasonConverter implements AttributeConverter<IngestReason, String> {

    @Override
    public String convertToDatabaseColumn(IngestReason reason) {
        return reason == null ? null : reason.code();
    }

    @Override
    public IngestReason convertToEntityAttribute(String code) {
        return code == null ? null : IngestReason.fromCode(code);
    }
}
