package com.platform.servicehost.security;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/**
 * Validator for SafePath annotation. The configured root is checked later by the
 * orchestrator; this layer only rejects structurally unsafe input early.
 */
public class SafePathValidator implements ConstraintValidator<SafePath, String> {
    
    private final PathGuard pathGuard = PathGuard.structural();
    
    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        if (value == null || value.isBlank()) {
            return true;
        }
        GuardResult result = pathGuard.validate(value);
        if (result.isRejected()) {
            context.disableDefaultConstraintViolation();
            context.buildConstraintViolationWithTemplate(result.reason()).addConstraintViolation();
            return false;
        }
        return true;
    }
}
