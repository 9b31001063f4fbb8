package tech.homeport.secrets.resolve;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Optional;

/**
 * Configuration for secret resolution and the built-in providers.
 */
@ConfigMapping(prefix = "homeport.secrets")
public interface SecretsEngineConfig {

    Resolver resolver();

    Aws aws();

    Gcp gcp();

    Azure azure();

    Vault vault();

    File file();

    Manual manual();

    interface Resolver {
        /**
         * Env file with secret values, consulted before anything else.
         */
        Optional<String> secretsFile();

        /**
         * Redirect all cloud-sourced secrets to one store: aws, gcp or azure.
         */
        Optional<String> pullFrom();

        @WithDefault("HOMEPORT_SECRET_")
        String envPrefix();

        @WithDefault("true")
        boolean allowInteractive();

        /**
         * Fail resolution when a required secret has no value.
         */
        @WithDefault("true")
        boolean failOnMissing();

        /**
         * Budget for the whole resolution chain of one secret.
         */
        @WithDefault("30s")
        Duration timeout();
    }

    interface Aws {
        Optional<String> profile();

        Optional<String> region();
    }

    interface Gcp {
        /**
         * Project used for short secret locators.
         */
        Optional<String> project();

        @WithDefault("gcloud")
        String cli();
    }

    interface Azure {
        /**
         * Vault used for bare secret names.
         */
        Optional<String> vaultName();

        Optional<String> subscription();

        @WithDefault("az")
        String cli();
    }

    interface Vault {
        Optional<String> address();

        Optional<String> token();

        Optional<String> namespace();

        /**
         * KV v2 mount used when a locator does not name one.
         */
        @WithDefault("secret")
        String mount();

        @WithDefault("vault")
        String cli();
    }

    interface File {
        /**
         * Base directory for relative file locators. Defaults to the working directory.
         */
        Optional<String> basePath();
    }

    interface Manual {
        @WithDefault("true")
        boolean maskInput();

        @WithDefault("false")
        boolean nonInteractive();
    }
}
