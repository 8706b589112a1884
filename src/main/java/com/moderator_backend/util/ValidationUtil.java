package com.moderator_backend.util;

import jakarta.validation.ConstraintViolation;

import java.util.Set;
import java.util.stream.Collectors;

public class ValidationUtil {
    public static boolean stringExists(String str){
        return str != null && !str.isEmpty() && !str.isBlank();
    }

    public static String describe(Set<? extends ConstraintViolation<?>> violations) {
        return violations.stream()
                .map(violation -> violation.getPropertyPath() + ": " + violation.getMessage())
                .sorted()
                .collect(Collectors.joining(", "));
    }
}
