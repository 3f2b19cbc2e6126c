package com.platform.servicehost.security;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/**
 * Validator for SafeArguments annotation.
 */
public class SafeArgumentsValidator implements ConstraintValidator<SafeArguments, String> {
    
    private final CommandGuard commandGuard = new CommandGuard();
    
    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        GuardResult result = commandGuard.validate(value);
        if (result.isRejected()) {
            context.disableDefaultConstraintViolation();
            context.buildConstraintViolationWithTemplate(result.reason()).addConstraintViolation();
            return false;
        }
        return true;
    }
}
