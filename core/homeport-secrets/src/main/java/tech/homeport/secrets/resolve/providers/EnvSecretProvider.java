package tech.homeport.secrets.resolve.providers;

import tech.homeport.secrets.errors.SecretResolutionException;
import tech.homeport.secrets.model.SecretReference;
import tech.homeport.secrets.model.SecretSource;
import tech.homeport.secrets.resolve.EnvironmentSource;
import tech.homeport.secrets.resolve.ResolutionContext;
import tech.homeport.secrets.resolve.SecretProvider;

/**
 * Reads secrets from environment variables. The reference key names the variable.
 */
public class EnvSecretProvider implements SecretProvider {

    private final EnvironmentSource environment;

    public EnvSecretProvider() {
        this(EnvironmentSource.system());
    }

    public EnvSecretProvider(EnvironmentSource environment) {
        this.environment = environment;
    }

    @Override
    public SecretSource name() {
        return SecretSource.ENV;
    }

    @Override
    public boolean canResolve(SecretReference ref) {
        return ref.source == SecretSource.ENV && ref.hasKey();
    }

    @Override
    public String resolve(ResolutionContext context, SecretReference ref) {
        if (!ref.hasKey()) {
            throw SecretResolutionException.notFound(ref.name, "No environment variable named for secret " + ref.name);
        }
        return environment.get(ref.key)
            .filter(value -> !value.isEmpty())
            .orElseThrow(() -> SecretResolutionException.notFound(ref.name,
                "Environment variable " + ref.key + " is not set"));
    }

    @Override
    public void validateConfig() {
        // the process environment is always readable
    }
}
