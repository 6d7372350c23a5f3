package tech.yump.vaultclient.config.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;
import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Documented
@Constraint(validatedBy = SecretRequestConfigValidator.class)
@Target({ ElementType.TYPE })
@Retention(RetentionPolicy.RUNTIME)
public @interface ValidSecretRequest {
  String message() default "Secret request (vault.requests[*]) is invalid for its kind.";
  Class<?>[] groups() default {};
  Class<? extends Payload>[] payload() default {};
}
