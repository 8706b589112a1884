package com.moderator_backend.validation.validator;

import com.moderator_backend.entity.User;
import com.moderator_backend.validation.validation.ValidUserExtra;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class UserExtraValidator implements ConstraintValidator<ValidUserExtra, User> {

    @Override
    public boolean isValid(User user, ConstraintValidatorContext context) {
        // a missing group is reported by @NotNull on the field
        if (user == null || user.getExtra() == null || user.getGroup() == null) {
            return true;
        }
        if (user.getExtra().owningGroup() == user.getGroup()) {
            return true;
        }

        context.disableDefaultConstraintViolation();
        context.buildConstraintViolationWithTemplate(
                "Extra payload of type '" + user.getExtra().typeTag()
                        + "' is not allowed for group '" + user.getGroup().getValue() + "'"
        ).addPropertyNode("extra").addConstraintViolation();
        return false;
    }
}
