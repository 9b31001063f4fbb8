package tech.homeport.secrets.resolve;

import org.jboss.logging.Logger;
import tech.homeport.secrets.envfile.EnvFiles;
import tech.homeport.secrets.errors.MissingSecretsException;
import tech.homeport.secrets.errors.SecretErrorKind;
import tech.homeport.secrets.errors.SecretResolutionException;
import tech.homeport.secrets.model.ResolvedSecrets;
import tech.homeport.secrets.model.SecretReference;
import tech.homeport.secrets.model.SecretSource;
import tech.homeport.secrets.model.SecretsManifest;
import tech.homeport.secrets.naming.SecretMasking;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves manifest entries to values through a fixed chain of sources.
 *
 * For each secret the chain is tried in order, each step only if the
 * previous produced nothing:
 * <ol>
 *   <li>the secrets file, matched by name</li>
 *   <li>the environment variable {@code <prefix><NAME>}, or the variable named by
 *       the key for env-sourced secrets</li>
 *   <li>the forced cloud store, for cloud-sourced secrets when {@code pullFrom} is set</li>
 *   <li>the provider registered for the secret's source</li>
 *   <li>the interactive prompt, when enabled</li>
 * </ol>
 * One timeout covers the whole chain of a secret. Failures of individual steps
 * are logged at debug level and the chain moves on.
 *
 * SECURITY: values are never logged. The returned {@link ResolvedSecrets}
 * must be cleared by the caller once used.
 */
public class SecretResolver {

    private static final Logger LOG = Logger.getLogger(SecretResolver.class);

    private final ResolverOptions options;
    private final EnvironmentSource environment;
    private final Map<SecretSource, SecretProvider> providers = new EnumMap<>(SecretSource.class);
    private final Map<Path, Map<String, String>> fileCache = new HashMap<>();
    private volatile PromptCallback promptCallback;

    public SecretResolver(ResolverOptions options) {
        this(options, EnvironmentSource.system());
    }

    public SecretResolver(ResolverOptions options, EnvironmentSource environment) {
        this.options = options == null ? ResolverOptions.defaults() : options;
        this.environment = environment;
    }

    /**
     * Register a provider for its source, replacing any previous one.
     */
    public synchronized void registerProvider(SecretProvider provider) {
        providers.put(provider.name(), provider);
    }

    public synchronized Optional<SecretProvider> getProvider(SecretSource source) {
        return Optional.ofNullable(providers.get(source));
    }

    public void setPromptCallback(PromptCallback promptCallback) {
        this.promptCallback = promptCallback;
    }

    public ResolverOptions options() {
        return options;
    }

    /**
     * Resolve every secret of the manifest.
     *
     * All secrets are attempted; unresolved required secrets are collected
     * and reported together. If the calling thread is interrupted, the
     * remaining secrets are not attempted and count as unresolved.
     *
     * @return resolved values, possibly partial when {@code failOnMissing} is off
     * @throws MissingSecretsException when {@code failOnMissing} is on and required
     *                                 secrets are missing; it carries the partial result
     */
    public ResolvedSecrets resolveAll(SecretsManifest manifest) {
        ResolvedSecrets resolved = new ResolvedSecrets();
        List<String> missing = new ArrayList<>();
        Map<SecretProvider, Map<String, String>> prefetched = prefetch(manifest);

        boolean interrupted = false;
        for (SecretReference ref : manifest.secrets()) {
            if (!interrupted && Thread.currentThread().isInterrupted()) {
                LOG.warn("Secret resolution interrupted, remaining secrets are left unresolved");
                interrupted = true;
            }

            Optional<Resolution> resolution = interrupted ? Optional.empty() : resolveOne(ref, prefetched);
            if (resolution.isPresent()) {
                resolved.add(ref, resolution.get().value(), resolution.get().resolvedFrom());
                LOG.debugf("Resolved secret %s from %s", ref.name, resolution.get().resolvedFrom());
            } else if (ref.required) {
                missing.add(ref.name);
            } else {
                LOG.debugf("Optional secret %s not resolved", ref.name);
            }
        }
        prefetched.values().forEach(Map::clear);

        LOG.infof("Resolved %d of %d secrets", resolved.count(), manifest.size());
        if (!missing.isEmpty()) {
            LOG.warnf("Missing required secrets: %s", String.join(", ", missing));
            if (options.failOnMissing()) {
                throw new MissingSecretsException(missing, resolved);
            }
        }
        return resolved;
    }

    /**
     * Resolve one secret through the chain.
     *
     * @throws SecretResolutionException with kind SECRET_NOT_RESOLVED when no step yields a value
     */
    public String resolve(SecretReference ref) {
        return resolveOne(ref, Map.of())
            .map(Resolution::value)
            .orElseThrow(() -> new SecretResolutionException(SecretErrorKind.SECRET_NOT_RESOLVED, ref.name,
                "secret could not be resolved: " + ref.name));
    }

    /**
     * Classify every secret without fetching it. Only the secrets file and the
     * environment are read; providers are asked for {@link SecretProvider#validateConfig()}
     * only, and the prompt is never shown.
     */
    public ResolvabilityReport checkResolvability(SecretsManifest manifest) {
        ResolvabilityReport report = new ResolvabilityReport();
        Map<SecretProvider, Boolean> usable = new IdentityHashMap<>();
        for (SecretReference ref : manifest.secrets()) {
            report.put(ref.name, checkOne(ref, usable));
        }
        return report;
    }

    /**
     * Drop cached secrets file content.
     */
    public synchronized void clearCache() {
        fileCache.clear();
    }

    private Optional<Resolution> resolveOne(SecretReference ref, Map<SecretProvider, Map<String, String>> prefetched) {
        ResolutionContext context = ResolutionContext.withTimeout(options.timeout());

        // 1. Secrets file
        Optional<Path> secretsFile = options.secretsFileOptional();
        if (secretsFile.isPresent()) {
            Optional<String> value = fromSecretsFile(secretsFile.get(), ref);
            if (value.isPresent()) {
                return Optional.of(new Resolution(value.get(), "file:" + secretsFile.get()));
            }
        }

        // 2. Environment
        Optional<Resolution> fromEnv = fromEnvironment(ref);
        if (fromEnv.isPresent()) {
            return fromEnv;
        }

        // 3. Forced cloud store
        Optional<SecretProvider> forced = forcedProvider(ref);
        if (forced.isPresent() && !context.isExpired()) {
            Optional<String> value = attempt(forced.get(), context, ref, prefetched);
            if (value.isPresent()) {
                return Optional.of(new Resolution(value.get(), "cloud:" + options.pullFrom().value()));
            }
        }

        // 4. Native provider
        Optional<SecretProvider> nativeProvider = getProvider(ref.source).filter(p -> p.canResolve(ref));
        boolean alreadyPrompted = false;
        if (nativeProvider.isPresent() && !context.isExpired()) {
            alreadyPrompted = nativeProvider.get().prompts();
            Optional<String> value = attempt(nativeProvider.get(), context, ref, prefetched);
            if (value.isPresent()) {
                return Optional.of(new Resolution(value.get(), "provider:" + ref.source.value()));
            }
        }

        // 5. Interactive prompt
        PromptCallback prompt = promptCallback;
        if (options.allowInteractive() && prompt != null && !alreadyPrompted && !context.isExpired()) {
            try {
                String value = prompt.prompt(ref);
                if (value != null && !value.isEmpty()) {
                    return Optional.of(new Resolution(value, "interactive"));
                }
                if (ref.required) {
                    LOG.warnf("No value entered for required secret %s", ref.name);
                }
            } catch (RuntimeException e) {
                LOG.debugf(e, "Prompt failed for secret %s", ref.name);
            }
        }

        if (context.isExpired()) {
            LOG.warnf("Timed out after %s resolving secret %s (%s)", options.timeout(), ref.name,
                SecretMasking.maskReference(ref.key));
        }
        return Optional.empty();
    }

    private Optional<String> attempt(SecretProvider provider, ResolutionContext context, SecretReference ref,
                                     Map<SecretProvider, Map<String, String>> prefetched) {
        Map<String, String> batch = prefetched.get(provider);
        if (batch != null) {
            String value = batch.remove(ref.name);
            if (value != null && !value.isEmpty()) {
                return Optional.of(value);
            }
        }
        try {
            String value = provider.resolve(context, ref);
            return Optional.ofNullable(value).filter(v -> !v.isEmpty());
        } catch (RuntimeException e) {
            LOG.debugf("Provider %s could not resolve %s (%s): %s", provider.name(), ref.name,
                SecretMasking.maskReference(ref.key), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Fetch in one round trip, per batch-capable provider, the secrets that
     * the secrets file and environment do not cover.
     */
    private Map<SecretProvider, Map<String, String>> prefetch(SecretsManifest manifest) {
        Map<SecretProvider, List<SecretReference>> groups = new LinkedHashMap<>();
        for (SecretReference ref : manifest.secrets()) {
            if (coveredLocally(ref)) {
                continue;
            }
            Optional<SecretProvider> provider = forcedProvider(ref)
                .or(() -> getProvider(ref.source).filter(p -> p.canResolve(ref)));
            if (provider.isPresent() && provider.get() instanceof BatchSecretProvider) {
                groups.computeIfAbsent(provider.get(), p -> new ArrayList<>()).add(ref);
            }
        }

        Map<SecretProvider, Map<String, String>> prefetched = new IdentityHashMap<>();
        groups.forEach((provider, refs) -> {
            if (refs.size() < 2) {
                return;
            }
            try {
                BatchResult result = ((BatchSecretProvider) provider)
                    .resolveBatch(ResolutionContext.withTimeout(options.timeout()), refs);
                prefetched.put(provider, new HashMap<>(result.secrets()));
                LOG.debugf("Batch fetched %d of %d secrets from %s",
                    result.secrets().size(), refs.size(), provider.name());
            } catch (RuntimeException e) {
                LOG.debugf("Batch fetch from %s failed, falling back to single fetches: %s",
                    provider.name(), e.getMessage());
            }
        });
        return prefetched;
    }

    private boolean coveredLocally(SecretReference ref) {
        return options.secretsFileOptional().flatMap(path -> fromSecretsFile(path, ref)).isPresent()
            || fromEnvironment(ref).isPresent();
    }

    private Optional<SecretProvider> forcedProvider(SecretReference ref) {
        if (!ref.source.isCloudProvider()) {
            return Optional.empty();
        }
        return options.pullFromSource().flatMap(this::getProvider);
    }

    private ResolvabilityStatus checkOne(SecretReference ref, Map<SecretProvider, Boolean> usable) {
        Optional<Path> secretsFile = options.secretsFileOptional();
        if (secretsFile.isPresent() && fromSecretsFile(secretsFile.get(), ref).isPresent()) {
            return new ResolvabilityStatus(ResolvabilityState.RESOLVABLE, "secrets-file");
        }
        if (fromEnvironment(ref).isPresent()) {
            return new ResolvabilityStatus(ResolvabilityState.RESOLVABLE, "environment");
        }

        Optional<SecretProvider> forced = forcedProvider(ref);
        if (forced.isPresent() && isUsable(forced.get(), usable)) {
            return new ResolvabilityStatus(ResolvabilityState.MAYBE_RESOLVABLE, "cloud:" + options.pullFrom().value());
        }

        Optional<SecretProvider> provider = getProvider(ref.source).filter(p -> p.canResolve(ref));
        if (provider.isPresent() && isUsable(provider.get(), usable)) {
            return new ResolvabilityStatus(ResolvabilityState.MAYBE_RESOLVABLE, ref.source.value());
        }

        if (options.allowInteractive() && promptCallback != null) {
            return new ResolvabilityStatus(ResolvabilityState.NEEDS_INTERACTIVE, "interactive-prompt");
        }
        return new ResolvabilityStatus(ResolvabilityState.UNRESOLVABLE, "none");
    }

    private static boolean isUsable(SecretProvider provider, Map<SecretProvider, Boolean> usable) {
        return usable.computeIfAbsent(provider, p -> {
            try {
                p.validateConfig();
                return true;
            } catch (RuntimeException e) {
                LOG.debugf("Provider %s not usable: %s", p.name(), e.getMessage());
                return false;
            }
        });
    }

    private Optional<Resolution> fromEnvironment(SecretReference ref) {
        String variable = options.envPrefix() + ref.name;
        Optional<String> value = environment.get(variable).filter(v -> !v.isEmpty());
        if (value.isPresent()) {
            return Optional.of(new Resolution(value.get(), "env:" + variable));
        }
        if (ref.source == SecretSource.ENV && ref.hasKey()) {
            return environment.get(ref.key)
                .filter(v -> !v.isEmpty())
                .map(v -> new Resolution(v, "env:" + ref.key));
        }
        return Optional.empty();
    }

    private Optional<String> fromSecretsFile(Path path, SecretReference ref) {
        return secretsFileEntries(path)
            .map(entries -> entries.get(ref.name))
            .filter(v -> !v.isEmpty());
    }

    /**
     * Parsed secrets file. The returned map is unmodifiable and stays intact
     * when the cache is cleared.
     */
    synchronized Optional<Map<String, String>> secretsFileEntries(Path path) {
        Map<String, String> cached = fileCache.get(path);
        if (cached != null) {
            return Optional.of(cached);
        }
        try {
            Map<String, String> entries = Collections.unmodifiableMap(EnvFiles.read(path));
            fileCache.put(path, entries);
            return Optional.of(entries);
        } catch (IOException e) {
            LOG.debugf("Secrets file %s not readable: %s", path, e.getMessage());
            return Optional.empty();
        }
    }

    private record Resolution(String value, String resolvedFrom) {
        @Override
        public String toString() {
            return "Resolution{resolvedFrom=" + resolvedFrom + "}";
        }
    }
}
