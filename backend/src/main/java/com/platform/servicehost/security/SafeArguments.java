package com.platform.servicehost.security;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.*;

/**
 * Field holds a process-argument string that must pass {@link CommandGuard}.
 */
@Documented
@Constraint(validatedBy = SafeArgumentsValidator.class)
@Target({ElementType.FIELD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
public @interface SafeArguments {
    
    String message() default "Unsafe arguments";
    
    Class<?>[] groups() default {};
    
    Class<? extends Payload>[] payload() default {};
}
