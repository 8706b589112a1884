package com.moderator_backend.validation.validation;

import com.moderator_backend.validation.validator.HumanEmailValidator;
import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.*;

@Target({ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Constraint(validatedBy = HumanEmailValidator.class)
@Documented
public @interface RequireEmailForHumans {
    String message() default "Email address required for human users";

    Class<?>[] groups() default {};
    Class<? extends Payload>[] payload() default {};
}
