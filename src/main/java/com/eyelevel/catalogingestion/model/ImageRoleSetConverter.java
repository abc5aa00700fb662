package com.eyelevel.catalogingestion.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.springframework.util.StringUtils;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Stores a set of {@link ImageRole}s as a comma separated column, e.g. {@code primary,gallery}.
 */
@Converter
public class ImageRoleSetConverter implements AttributeConverter<Set<ImageRole>, String> {

    @Override
    public String convertToDatabaseColumn(Set<ImageRole> roles) {
        if (roles == null || roles.isEmpty()) {
            return "";
        }
        return roles.stream().sorted().map(ImageRole::getValue).collect(Collectors.joining(","));
    }

    @Override
    public Set<ImageRole> convertToEntityAttribute(String column) {
        Set<ImageRole> roles = EnumSet.noneOf(ImageRole.class);
        if (!StringUtils.hasText(column)) {
            return roles;
        }
        Arrays.stream(column.split(",")).map(String::trim).filter(StringUtils::hasText)
              .map(ImageRole::convertByValue).forEach(roles::add);
        return roles;
    }
}
