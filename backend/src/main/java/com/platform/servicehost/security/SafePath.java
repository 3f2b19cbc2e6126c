package com.platform.servicehost.security;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.*;

/**
 * Field holds a filesystem path that must pass {@link PathGuard}'s structural checks.
 * Null and blank values are left to {@code @NotBlank}.
 */
@Documented
@Constraint(validatedBy = SafePathValidator.class)
@Target({ElementType.FIELD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
public @interface SafePath {
    
    String message() default "Unsafe path";
    
    Class<?>[] groups() default {};
    
    Class<? extends Payload>[] payload() default {};
}
