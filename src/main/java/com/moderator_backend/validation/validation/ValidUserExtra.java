package com.moderator_backend.validation.validation;

import com.moderator_backend.validation.validator.UserExtraValidator;
import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.*;

@Target({ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Constraint(validatedBy = UserExtraValidator.class)
@Documented
public @interface ValidUserExtra {
    String message() default "Extra payload does not match the user group";

    Class<?>[] groups() default {};
    Class<? extends Payload>[] payload() default {};
}
