package com.ruian.entity;

import com.ruian.entity.EmployeeWorklog.ValidationResult;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link ValidationResult} as the label the schema expects
 * (e.g. '未校验'), not the enum name.
 */
@Converter
public class ValidationResultConverter implements AttributeConverter<ValidationResult, String> {

    @Override
    public String convertToDatabaseColumn(ValidationResult attribute) {
        return attribute == null ? ValidationResult.UNVALIDATED.getLabel() : attribute.getLabel();
    }

    @Override
    public ValidationResult convertToEntityAttribute(String dbData) {
        return dbData == null ? ValidationResult.UNVALIDATED : ValidationResult.fromLabel(dbData);
    }
}
