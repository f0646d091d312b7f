package com.demo.companion.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores roles as their enum name and reads them back through
 * {@link MessageRole#parse}, so a row holding any other role fails the read.
 */
@Converter
public class MessageRoleConverter implements AttributeConverter<MessageRole, String> {

    @Override
    public String convertToDatabaseColumn(MessageRole role) {
        return role != null ? role.name() : null;
    }

    @Override
    public MessageRole convertToEntityAttribute(String value) {
        return MessageRole.parse(value);
    }
}
