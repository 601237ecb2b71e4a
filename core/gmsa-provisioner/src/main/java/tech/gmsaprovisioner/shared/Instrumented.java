package tech.gmsaprovisioner.shared;

import jakarta.interceptor.InterceptorBinding;

import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Times every call into a remote dependency (the directory, Key Vault) and
 * tags it with the outcome.
 *
 * <p>Produces {@code gmsa_dependency_call_seconds{dependency,operation,outcome}}
 * where outcome is {@code ok} or the error kind of the failure.
 */
@Inherited
@InterceptorBinding
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface Instrumented {

    /** Value of the {@code dependency} tag. */
    String target() default "";
}
