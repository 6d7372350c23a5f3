package tech.yump.vaultclient.config.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import tech.yump.vaultclient.config.VaultClientProperties;
import tech.yump.vaultclient.secrets.SecretServiceException;

/**
 * Checks a configured secret request descriptor by building the typed request from it,
 * so bind-time validation and runtime construction share the same rules.
 */
public class SecretRequestConfigValidator implements ConstraintValidator<ValidSecretRequest, VaultClientProperties.SecretRequestProperties> {

  @Override
  public boolean isValid(VaultClientProperties.SecretRequestProperties value, ConstraintValidatorContext context) {
    if (value == null) {
      return true;
    }
    try {
      value.toSecretRequest();
      return true;
    } catch (SecretServiceException e) {
      context.disableDefaultConstraintViolation();
      context.buildConstraintViolationWithTemplate(escape(e.getMessage()))
          .addConstraintViolation();
      return false;
    }
  }

  // Message templates treat braces and dollar signs as expressions.
  private static String escape(String message) {
    return message.replace("\\", "\\\\")
        .replace("{", "\\{")
        .replace("}", "\\}")
        .replace("$", "\\$");
  }
}
