package tech.homeport.secrets.resolve;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tech.homeport.secrets.errors.MissingSecretsException;
import tech.homeport.secrets.errors.SecretErrorKind;
import tech.homeport.secrets.errors.SecretResolutionException;
import tech.homeport.secrets.model.ResolvedSecrets;
import tech.homeport.secrets.model.SecretReference;
import tech.homeport.secrets.model.SecretSource;
import tech.homeport.secrets.model.SecretsManifest;
import tech.homeport.secrets.resource.CloudProvider;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * Unit tests for SecretResolver.
 */
class SecretResolverTest {

    @TempDir
    Path tempDir;

    private SecretsManifest manifest;

    @BeforeEach
    void setUp() {
        manifest = new SecretsManifest();
    }

    private SecretResolver resolver(ResolverOptions options, Map<String, String> env) {
        return new SecretResolver(options, EnvironmentSource.of(env));
    }

    // ========================================
    // Resolution chain
    // ========================================

    @Nested
    @DisplayName("Resolution chain")
    class ChainTests {

        @Test
        @DisplayName("secrets file should take precedence over the environment")
        void resolveAll_shouldPreferSecretsFile() throws IOException {
            // Arrange
            Path secretsFile = tempDir.resolve("secrets.env");
            Files.writeString(secretsFile, "DB_PASSWORD=from-file\n");
            manifest.addSecret(SecretReference.of("DB_PASSWORD", SecretSource.MANUAL));
            var options = ResolverOptions.defaults().withSecretsFile(secretsFile).withAllowInteractive(false);
            var resolver = resolver(options, Map.of("HOMEPORT_SECRET_DB_PASSWORD", "from-env"));

            // Act
            ResolvedSecrets resolved = resolver.resolveAll(manifest);

            // Assert
            assertThat(resolved.getValue("DB_PASSWORD")).contains("from-file");
            assertThat(resolved.get("DB_PASSWORD").orElseThrow().resolvedFrom()).isEqualTo("file:" + secretsFile);
        }

        @Test
        void resolveAll_fallsThroughEmptyFileValueToEnvironment() throws IOException {
            Path secretsFile = tempDir.resolve("secrets.env");
            Files.writeString(secretsFile, "DB_PASSWORD=\n");
            manifest.addSecret(SecretReference.of("DB_PASSWORD", SecretSource.MANUAL));
            var options = ResolverOptions.defaults().withSecretsFile(secretsFile).withAllowInteractive(false);

            ResolvedSecrets resolved = resolver(options, Map.of("HOMEPORT_SECRET_DB_PASSWORD", "from-env"))
                .resolveAll(manifest);

            assertThat(resolved.get("DB_PASSWORD").orElseThrow().resolvedFrom())
                .isEqualTo("env:HOMEPORT_SECRET_DB_PASSWORD");
        }

        @Test
        void resolveAll_readsEnvSourcedSecretFromItsKey() {
            manifest.addSecret(SecretReference.of("API_TOKEN", SecretSource.ENV).withKey("CI_API_TOKEN"));

            ResolvedSecrets resolved = resolver(ResolverOptions.defaults().withAllowInteractive(false),
                Map.of("CI_API_TOKEN", "t0k3n")).resolveAll(manifest);

            assertThat(resolved.getValue("API_TOKEN")).contains("t0k3n");
            assertThat(resolved.get("API_TOKEN").orElseThrow().resolvedFrom()).isEqualTo("env:CI_API_TOKEN");
        }

        @Test
        void resolveAll_honoursCustomEnvPrefix() {
            manifest.addSecret(SecretReference.of("API_TOKEN", SecretSource.MANUAL));
            var options = ResolverOptions.defaults().withEnvPrefix("APP_").withAllowInteractive(false);

            ResolvedSecrets resolved = resolver(options, Map.of("APP_API_TOKEN", "abc")).resolveAll(manifest);

            assertThat(resolved.get("API_TOKEN").orElseThrow().resolvedFrom()).isEqualTo("env:APP_API_TOKEN");
        }

        @Test
        @DisplayName("forced cloud store should be tried before the native provider")
        void resolveAll_shouldUseForcedCloudProviderFirst() {
            // Arrange
            manifest.addSecret(SecretReference.of("DB_PASSWORD", SecretSource.AWS_SECRETS_MANAGER).withKey("prod/db"));
            var aws = new StubProvider(SecretSource.AWS_SECRETS_MANAGER).value("prod/db", "from-aws");
            var gcp = new StubProvider(SecretSource.GCP_SECRET_MANAGER).value("prod/db", "from-gcp");
            var resolver = resolver(ResolverOptions.defaults().withPullFrom(CloudProvider.GCP)
                .withAllowInteractive(false), Map.of());
            resolver.registerProvider(aws);
            resolver.registerProvider(gcp);

            // Act
            ResolvedSecrets resolved = resolver.resolveAll(manifest);

            // Assert
            assertThat(resolved.getValue("DB_PASSWORD")).contains("from-gcp");
            assertThat(resolved.get("DB_PASSWORD").orElseThrow().resolvedFrom()).isEqualTo("cloud:gcp");
            assertThat(aws.calls).isEmpty();
        }

        @Test
        void resolveAll_fallsBackToNativeProviderWhenForcedStoreFails() {
            manifest.addSecret(SecretReference.of("DB_PASSWORD", SecretSource.AWS_SECRETS_MANAGER).withKey("prod/db"));
            var resolver = resolver(ResolverOptions.defaults().withPullFrom(CloudProvider.AZURE)
                .withAllowInteractive(false), Map.of());
            resolver.registerProvider(new StubProvider(SecretSource.AWS_SECRETS_MANAGER).value("prod/db", "from-aws"));
            resolver.registerProvider(new StubProvider(SecretSource.AZURE_KEY_VAULT));

            ResolvedSecrets resolved = resolver.resolveAll(manifest);

            assertThat(resolved.get("DB_PASSWORD").orElseThrow().resolvedFrom())
                .isEqualTo("provider:aws-secrets-manager");
        }

        @Test
        void resolveAll_doesNotRedirectNonCloudSecrets() {
            manifest.addSecret(SecretReference.of("VAULT_TOKEN", SecretSource.HASHICORP_VAULT).withKey("app#token"));
            var gcp = new StubProvider(SecretSource.GCP_SECRET_MANAGER).value("app#token", "wrong");
            var resolver = resolver(ResolverOptions.defaults().withPullFrom(CloudProvider.GCP)
                .withAllowInteractive(false), Map.of());
            resolver.registerProvider(gcp);
            resolver.registerProvider(new StubProvider(SecretSource.HASHICORP_VAULT).value("app#token", "right"));

            assertThat(resolver.resolveAll(manifest).getValue("VAULT_TOKEN")).contains("right");
            assertThat(gcp.calls).isEmpty();
        }

        @Test
        void resolveAll_promptsAsLastResort() {
            manifest.addSecret(SecretReference.of("API_KEY", SecretSource.MANUAL));
            var resolver = resolver(ResolverOptions.defaults(), Map.of());
            List<String> prompted = new ArrayList<>();
            resolver.setPromptCallback(ref -> {
                prompted.add(ref.name);
                return "typed";
            });

            ResolvedSecrets resolved = resolver.resolveAll(manifest);

            assertThat(prompted).containsExactly("API_KEY");
            assertThat(resolved.get("API_KEY").orElseThrow().resolvedFrom()).isEqualTo("interactive");
        }

        @Test
        void resolveAll_doesNotPromptAgainAfterPromptingProvider() {
            manifest.addSecret(SecretReference.of("API_KEY", SecretSource.MANUAL).withKey("api"));
            var resolver = resolver(ResolverOptions.defaults().withFailOnMissing(false), Map.of());
            var manual = new StubProvider(SecretSource.MANUAL).prompting();
            resolver.registerProvider(manual);
            resolver.setPromptCallback(ref -> fail("operator was already asked for " + ref.name));

            ResolvedSecrets resolved = resolver.resolveAll(manifest);

            assertThat(manual.calls).containsExactly("API_KEY");
            assertThat(resolved.count()).isZero();
        }

        @Test
        void resolveAll_promptsAfterNonPromptingProvider() {
            manifest.addSecret(SecretReference.of("API_KEY", SecretSource.MANUAL).withKey("api"));
            var resolver = resolver(ResolverOptions.defaults(), Map.of());
            resolver.registerProvider(new StubProvider(SecretSource.MANUAL));
            resolver.setPromptCallback(ref -> "typed");

            assertThat(resolver.resolveAll(manifest).get("API_KEY").orElseThrow().resolvedFrom())
                .isEqualTo("interactive");
        }

        @Test
        void resolveAll_skipsPromptWhenInteractiveDisabled() {
            manifest.addSecret(SecretReference.of("API_KEY", SecretSource.MANUAL).optional());
            var resolver = resolver(ResolverOptions.defaults().withAllowInteractive(false), Map.of());
            resolver.setPromptCallback(ref -> fail("prompt must not be shown"));

            assertThat(resolver.resolveAll(manifest).count()).isZero();
        }
    }

    // ========================================
    // Missing secrets
    // ========================================

    @Nested
    @DisplayName("Missing secrets")
    class MissingTests {

        @Test
        @DisplayName("resolveAll should report every missing required secret with the partial result")
        void resolveAll_shouldAggregateMissingSecrets() {
            // Arrange
            manifest.addSecret(SecretReference.of("A_SECRET", SecretSource.MANUAL));
            manifest.addSecret(SecretReference.of("B_SECRET", SecretSource.MANUAL));
            manifest.addSecret(SecretReference.of("C_SECRET", SecretSource.MANUAL));
            manifest.addSecret(SecretReference.of("D_SECRET", SecretSource.MANUAL).optional());
            var resolver = resolver(ResolverOptions.defaults(), Map.of("HOMEPORT_SECRET_B_SECRET", "b"));
            resolver.setPromptCallback(ref -> "");

            // Act
            MissingSecretsException e = catchThrowableOfType(() -> resolver.resolveAll(manifest),
                MissingSecretsException.class);

            // Assert
            assertThat(e).isNotNull();
            assertThat(e.kind()).isEqualTo(SecretErrorKind.SECRET_NOT_RESOLVED);
            assertThat(e.missingSecrets()).containsExactly("A_SECRET", "C_SECRET");
            assertThat(e.getMessage()).contains("A_SECRET, C_SECRET");
            assertThat(e.resolved().names()).containsExactly("B_SECRET");
        }

        @Test
        void resolveAll_returnsPartialResultWhenFailOnMissingDisabled() {
            manifest.addSecret(SecretReference.of("A_SECRET", SecretSource.MANUAL));
            manifest.addSecret(SecretReference.of("B_SECRET", SecretSource.MANUAL));
            var options = ResolverOptions.defaults().withFailOnMissing(false).withAllowInteractive(false);

            ResolvedSecrets resolved = resolver(options, Map.of("HOMEPORT_SECRET_A_SECRET", "a")).resolveAll(manifest);

            assertThat(resolved.names()).containsExactly("A_SECRET");
        }

        @Test
        void resolve_throwsNotResolvedForSingleSecret() {
            var resolver = resolver(ResolverOptions.defaults().withAllowInteractive(false), Map.of());

            assertThatThrownBy(() -> resolver.resolve(SecretReference.of("A_SECRET", SecretSource.MANUAL)))
                .isInstanceOf(SecretResolutionException.class)
                .hasMessageContaining("A_SECRET");
        }

        @Test
        @DisplayName("a provider exceeding the timeout should not be followed by the prompt")
        void resolveAll_shouldStopChainAfterTimeout() {
            manifest.addSecret(SecretReference.of("SLOW_SECRET", SecretSource.AZURE_KEY_VAULT).withKey("v/slow"));
            var options = ResolverOptions.defaults().withTimeout(Duration.ofMillis(100)).withFailOnMissing(false);
            var resolver = resolver(options, Map.of());
            resolver.registerProvider(new StubProvider(SecretSource.AZURE_KEY_VAULT).delay(Duration.ofMillis(300)));
            resolver.setPromptCallback(ref -> fail("prompt must not be shown after the deadline"));

            ResolvedSecrets resolved = resolver.resolveAll(manifest);

            assertThat(resolved.count()).isZero();
        }
    }

    // ========================================
    // Batch prefetch
    // ========================================

    @Test
    @DisplayName("secrets of one batch-capable provider should be fetched in a single batch")
    void resolveAll_shouldBatchFetchUncoveredSecrets() {
        manifest.addSecret(SecretReference.of("A_SECRET", SecretSource.AWS_SECRETS_MANAGER).withKey("a"));
        manifest.addSecret(SecretReference.of("B_SECRET", SecretSource.AWS_SECRETS_MANAGER).withKey("b"));
        manifest.addSecret(SecretReference.of("C_SECRET", SecretSource.AWS_SECRETS_MANAGER).withKey("c"));
        var provider = new StubBatchProvider(SecretSource.AWS_SECRETS_MANAGER)
            .value("a", "va").value("b", "vb").value("c", "vc");
        var resolver = resolver(ResolverOptions.defaults().withAllowInteractive(false),
            Map.of("HOMEPORT_SECRET_C_SECRET", "env-c"));
        resolver.registerProvider(provider);

        ResolvedSecrets resolved = resolver.resolveAll(manifest);

        assertThat(provider.batches).containsExactly(List.of("A_SECRET", "B_SECRET"));
        assertThat(provider.calls).isEmpty();
        assertThat(resolved.getValue("A_SECRET")).contains("va");
        assertThat(resolved.getValue("C_SECRET")).contains("env-c");
    }

    @Test
    void resolveAll_fetchesSinglyWhenMissingFromBatch() {
        manifest.addSecret(SecretReference.of("A_SECRET", SecretSource.AWS_SECRETS_MANAGER).withKey("a"));
        manifest.addSecret(SecretReference.of("B_SECRET", SecretSource.AWS_SECRETS_MANAGER).withKey("b"));
        var provider = new StubBatchProvider(SecretSource.AWS_SECRETS_MANAGER).value("a", "va").value("b", "vb");
        provider.batchOmits.add("B_SECRET");
        var resolver = resolver(ResolverOptions.defaults().withAllowInteractive(false), Map.of());
        resolver.registerProvider(provider);

        ResolvedSecrets resolved = resolver.resolveAll(manifest);

        assertThat(provider.calls).containsExactly("B_SECRET");
        assertThat(resolved.getValue("B_SECRET")).contains("vb");
    }

    // ========================================
    // Resolvability
    // ========================================

    @Test
    @DisplayName("checkResolvability should classify secrets without fetching any value")
    void checkResolvability_shouldNotFetch() throws IOException {
        // Arrange
        Path secretsFile = tempDir.resolve("secrets.env");
        Files.writeString(secretsFile, "FILE_SECRET=x\n");
        manifest.addSecret(SecretReference.of("FILE_SECRET", SecretSource.MANUAL));
        manifest.addSecret(SecretReference.of("ENV_SECRET", SecretSource.MANUAL));
        manifest.addSecret(SecretReference.of("CLOUD_SECRET", SecretSource.GCP_SECRET_MANAGER).withKey("db"));
        manifest.addSecret(SecretReference.of("BROKEN_SECRET", SecretSource.AZURE_KEY_VAULT).withKey("v/s"));
        manifest.addSecret(SecretReference.of("TYPED_SECRET", SecretSource.MANUAL));
        var resolver = resolver(ResolverOptions.defaults().withSecretsFile(secretsFile),
            Map.of("HOMEPORT_SECRET_ENV_SECRET", "y"));
        resolver.registerProvider(new StubProvider(SecretSource.GCP_SECRET_MANAGER).failOnResolve());
        resolver.registerProvider(new StubProvider(SecretSource.AZURE_KEY_VAULT).failOnResolve().unusable());
        resolver.setPromptCallback(ref -> fail("prompt must not be shown"));

        // Act
        ResolvabilityReport report = resolver.checkResolvability(manifest);

        // Assert
        assertThat(report.statusOf("FILE_SECRET"))
            .isEqualTo(new ResolvabilityStatus(ResolvabilityState.RESOLVABLE, "secrets-file"));
        assertThat(report.statusOf("ENV_SECRET").method()).isEqualTo("environment");
        assertThat(report.statusOf("CLOUD_SECRET"))
            .isEqualTo(new ResolvabilityStatus(ResolvabilityState.MAYBE_RESOLVABLE, "gcp-secret-manager"));
        assertThat(report.needsInteractive()).containsExactly("BROKEN_SECRET", "TYPED_SECRET");
        assertThat(report.canResolveAll(manifest)).isTrue();
    }

    @Test
    void checkResolvability_reportsUnresolvableWithoutPrompt() {
        manifest.addSecret(SecretReference.of("A_SECRET", SecretSource.MANUAL));
        manifest.addSecret(SecretReference.of("B_SECRET", SecretSource.MANUAL).optional());
        var resolver = resolver(ResolverOptions.defaults().withAllowInteractive(false), Map.of());

        ResolvabilityReport report = resolver.checkResolvability(manifest);

        assertThat(report.unresolvable()).containsExactly("A_SECRET", "B_SECRET");
        assertThat(report.statusOf("A_SECRET").method()).isEqualTo("none");
        assertThat(report.canResolveAll(manifest)).isFalse();
    }

    @Test
    void clearCache_rereadsSecretsFile() throws IOException {
        Path secretsFile = tempDir.resolve("secrets.env");
        Files.writeString(secretsFile, "A_SECRET=one\n");
        var resolver = resolver(ResolverOptions.defaults().withSecretsFile(secretsFile)
            .withAllowInteractive(false), Map.of());
        SecretReference ref = SecretReference.of("A_SECRET", SecretSource.MANUAL);
        assertThat(resolver.resolve(ref)).isEqualTo("one");

        Files.writeString(secretsFile, "A_SECRET=two\n");
        assertThat(resolver.resolve(ref)).isEqualTo("one");

        resolver.clearCache();
        assertThat(resolver.resolve(ref)).isEqualTo("two");
    }

    @Test
    void clearCache_leavesEntriesAlreadyHandedOutIntact() throws IOException {
        Path secretsFile = tempDir.resolve("secrets.env");
        Files.writeString(secretsFile, "A_SECRET=one\n");
        var resolver = resolver(ResolverOptions.defaults().withSecretsFile(secretsFile), Map.of());
        Map<String, String> entries = resolver.secretsFileEntries(secretsFile).orElseThrow();

        resolver.clearCache();

        assertThat(entries).containsExactly(entry("A_SECRET", "one"));
        assertThatThrownBy(entries::clear).isInstanceOf(UnsupportedOperationException.class);
    }

    // ========================================
    // Test doubles
    // ========================================

    static class StubProvider implements SecretProvider {
        final SecretSource source;
        final Map<String, String> values = new HashMap<>();
        final List<String> calls = new ArrayList<>();
        Duration delay = Duration.ZERO;
        boolean failOnResolve;
        boolean usable = true;
        boolean prompting;

        StubProvider(SecretSource source) {
            this.source = source;
        }

        StubProvider value(String key, String value) {
            values.put(key, value);
            return this;
        }

        StubProvider delay(Duration delay) {
            this.delay = delay;
            return this;
        }

        StubProvider failOnResolve() {
            this.failOnResolve = true;
            return this;
        }

        StubProvider unusable() {
            this.usable = false;
            return this;
        }

        StubProvider prompting() {
            this.prompting = true;
            return this;
        }

        @Override
        public boolean prompts() {
            return prompting;
        }

        @Override
        public SecretSource name() {
            return source;
        }

        @Override
        public boolean canResolve(SecretReference ref) {
            return ref.hasKey();
        }

        @Override
        public String resolve(ResolutionContext context, SecretReference ref) {
            if (failOnResolve) {
                fail("resolve must not be called for " + ref.name);
            }
            calls.add(ref.name);
            if (!delay.isZero()) {
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            String value = values.get(ref.key);
            if (value == null) {
                throw SecretResolutionException.notFound(ref.name, "not found: " + ref.key);
            }
            return value;
        }

        @Override
        public void validateConfig() {
            if (!usable) {
                throw SecretResolutionException.unavailable("not configured");
            }
        }
    }

    static class StubBatchProvider extends StubProvider implements BatchSecretProvider {
        final List<List<String>> batches = new ArrayList<>();
        final List<String> batchOmits = new ArrayList<>();

        StubBatchProvider(SecretSource source) {
            super(source);
        }

        @Override
        StubBatchProvider value(String key, String value) {
            super.value(key, value);
            return this;
        }

        @Override
        public BatchResult resolveBatch(ResolutionContext context, List<SecretReference> refs) {
            batches.add(refs.stream().map(r -> r.name).toList());
            Map<String, String> found = new HashMap<>();
            for (SecretReference ref : refs) {
                if (!batchOmits.contains(ref.name) && values.containsKey(ref.key)) {
                    found.put(ref.name, values.get(ref.key));
                }
            }
            return new BatchResult(found, Map.of());
        }
    }
}
