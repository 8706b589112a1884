package com.moderator_backend.validation.validator;

import com.moderator_backend.entity.User;
import com.moderator_backend.validation.validation.RequireEmailForHumans;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import org.apache.commons.validator.routines.EmailValidator;

/**
 * General and admin users are people and must be reachable by email. Service, youtube and
 * moderator accounts are exempt. The address is checked as stored: surrounding whitespace fails.
 */
public class HumanEmailValidator implements ConstraintValidator<RequireEmailForHumans, User> {

    @Override
    public boolean isValid(User user, ConstraintValidatorContext context) {
        if (user == null || user.getGroup() == null || !user.getGroup().isHuman()) {
            return true;
        }

        String email = user.getEmail();
        if (email != null && email.equals(email.strip()) && EmailValidator.getInstance().isValid(email)) {
            return true;
        }

        context.disableDefaultConstraintViolation();
        context.buildConstraintViolationWithTemplate(context.getDefaultConstraintMessageTemplate())
                .addPropertyNode("email")
                .addConstraintViolation();
        return false;
    }
}
