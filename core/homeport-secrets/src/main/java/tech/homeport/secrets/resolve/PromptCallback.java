package tech.homeport.secrets.resolve;

import tech.homeport.secrets.model.SecretReference;

/**
 * Asks the operator for a secret value. An empty answer means no value.
 */
@FunctionalInterface
public interface PromptCallback {

    String prompt(SecretReference ref);
}
