package tech.homeport.secrets.resolve.providers;

import org.jboss.logging.Logger;
import tech.homeport.secrets.errors.MissingSecretsException;
import tech.homeport.secrets.errors.SecretErrorKind;
import tech.homeport.secrets.errors.SecretResolutionException;
import tech.homeport.secrets.model.ResolvedSecrets;
import tech.homeport.secrets.model.SecretReference;
import tech.homeport.secrets.model.SecretSource;
import tech.homeport.secrets.model.SecretType;
import tech.homeport.secrets.naming.SecretMasking;
import tech.homeport.secrets.resolve.PromptCallback;
import tech.homeport.secrets.resolve.ResolutionContext;
import tech.homeport.secrets.resolve.SecretProvider;

import java.io.IOException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Asks the operator for secret values on the terminal.
 *
 * Entered values are cached by secret name until {@link #clearCache()}.
 * Preset defaults answer without prompting. Only one prompt is shown at a
 * time in the process.
 */
public class ManualSecretProvider implements SecretProvider {

    private static final Logger LOG = Logger.getLogger(ManualSecretProvider.class);

    private static final ReentrantLock PROMPT_LOCK = new ReentrantLock();

    private static final List<String> MASKED_NAME_PATTERNS = List.of(
        "password", "passwd", "secret", "key", "token", "credential", "auth", "private", "apikey", "api_key");

    private final Terminal terminal;
    private final Map<String, char[]> cache = new HashMap<>();
    private final Map<String, String> defaults = new HashMap<>();
    private volatile boolean maskInput = true;
    private volatile boolean nonInteractive;

    public ManualSecretProvider() {
        this(new ConsoleTerminal());
    }

    public ManualSecretProvider(Terminal terminal) {
        this.terminal = terminal;
    }

    public ManualSecretProvider withMasking(boolean maskInput) {
        this.maskInput = maskInput;
        return this;
    }

    public synchronized ManualSecretProvider withDefaults(Map<String, String> values) {
        defaults.putAll(values);
        return this;
    }

    public void setNonInteractive(boolean nonInteractive) {
        this.nonInteractive = nonInteractive;
    }

    @Override
    public SecretSource name() {
        return SecretSource.MANUAL;
    }

    /**
     * Any named secret can be entered by hand.
     */
    @Override
    public boolean canResolve(SecretReference ref) {
        return ref.source == SecretSource.MANUAL || (ref.name != null && !ref.name.isEmpty());
    }

    @Override
    public String resolve(ResolutionContext context, SecretReference ref) {
        return resolve(ref);
    }

    private String resolve(SecretReference ref) {
        synchronized (this) {
            char[] cached = cache.get(ref.name);
            if (cached != null) {
                return new String(cached);
            }
            String preset = defaults.get(ref.name);
            if (preset != null) {
                cache.put(ref.name, preset.toCharArray());
                return preset;
            }
        }

        if (nonInteractive) {
            throw new SecretResolutionException(SecretErrorKind.SECRET_NOT_RESOLVED, ref.name,
                "non-interactive mode: cannot prompt for secret " + ref.name);
        }

        String value = prompt(ref);
        synchronized (this) {
            cache.put(ref.name, value.toCharArray());
        }
        return value;
    }

    /**
     * Terminal must be interactive unless prompting is disabled.
     */
    @Override
    public void validateConfig() {
        if (nonInteractive) {
            return;
        }
        if (!terminal.isInteractive()) {
            throw SecretResolutionException.unavailable("stdin is not a terminal, cannot prompt for secrets");
        }
    }

    @Override
    public boolean prompts() {
        return !nonInteractive;
    }

    /**
     * Adapter for {@link tech.homeport.secrets.resolve.SecretResolver#setPromptCallback}.
     */
    public PromptCallback asPromptCallback() {
        return this::resolve;
    }

    /**
     * Prompt for several secrets in a row.
     *
     * @throws MissingSecretsException when a required secret gets no value; carries
     *                                 the values entered so far
     */
    public ResolvedSecrets promptBatch(List<SecretReference> refs) {
        ResolvedSecrets resolved = new ResolvedSecrets();
        terminal.print(String.format("%n=== Secret Entry ===%nPlease provide values for %d secrets:%n", refs.size()));

        for (SecretReference ref : refs) {
            try {
                resolved.add(ref, resolve(ref), "manual");
            } catch (SecretResolutionException e) {
                if (ref.required) {
                    throw new MissingSecretsException(List.of(ref.name), resolved);
                }
                LOG.debugf("Skipping optional secret %s: %s", ref.name, e.getMessage());
            }
        }

        terminal.print(String.format("=== Secret Entry Complete ===%n%n"));
        return resolved;
    }

    /**
     * Show the cached values masked and ask the operator to confirm.
     */
    public boolean confirmSecrets(List<SecretReference> refs) {
        StringBuilder sb = new StringBuilder(String.format("%nSecrets to be used:%n"));
        synchronized (this) {
            for (SecretReference ref : refs) {
                char[] value = cache.get(ref.name);
                String shown = value == null ? "(not set)" : SecretMasking.maskValue(new String(value));
                sb.append(String.format("  %s: %s%n", ref.name, shown));
            }
        }
        sb.append(String.format("%nProceed with these secrets? [y/N]: "));

        PROMPT_LOCK.lock();
        try {
            terminal.print(sb.toString());
            String answer = terminal.readLine();
            if (answer == null) {
                return false;
            }
            answer = answer.trim().toLowerCase(Locale.ROOT);
            return answer.equals("y") || answer.equals("yes");
        } catch (IOException e) {
            throw new SecretResolutionException(SecretErrorKind.PROVIDER_UNAVAILABLE, null,
                "Failed to read confirmation", e);
        } finally {
            PROMPT_LOCK.unlock();
        }
    }

    public synchronized void preloadCache(Map<String, String> values) {
        values.forEach((name, value) -> cache.put(name, value.toCharArray()));
    }

    public synchronized boolean isCached(String name) {
        return cache.containsKey(name);
    }

    /**
     * Overwrite and drop every cached value.
     */
    public synchronized void clearCache() {
        cache.values().forEach(value -> Arrays.fill(value, '\0'));
        cache.clear();
    }

    String buildPrompt(SecretReference ref) {
        StringBuilder sb = new StringBuilder();
        if (ref.description != null && !ref.description.isEmpty()) {
            sb.append(String.format("%n# %s%n", ref.description));
        }
        sb.append(ref.required ? "[REQUIRED] " : "[OPTIONAL] ");
        sb.append("Enter value for ").append(ref.name);
        if (ref.type != null && ref.type != SecretType.GENERIC) {
            sb.append(" (").append(ref.type.value()).append(')');
        }
        return sb.append(": ").toString();
    }

    boolean shouldMask(SecretReference ref) {
        if (!maskInput) {
            return false;
        }
        if (ref.type != null && ref.type.isMasked()) {
            return true;
        }
        String lower = ref.name.toLowerCase(Locale.ROOT);
        return MASKED_NAME_PATTERNS.stream().anyMatch(lower::contains);
    }

    private String prompt(SecretReference ref) {
        String value;
        PROMPT_LOCK.lock();
        try {
            terminal.print(buildPrompt(ref));
            if (shouldMask(ref)) {
                value = terminal.readHidden();
                terminal.print(System.lineSeparator());
            } else {
                value = terminal.readLine();
            }
        } catch (IOException e) {
            throw new SecretResolutionException(SecretErrorKind.SECRET_NOT_RESOLVED, ref.name,
                "Failed to read value for secret " + ref.name, e);
        } finally {
            PROMPT_LOCK.unlock();
        }

        value = value == null ? "" : value.trim();
        if (value.isEmpty() && ref.required) {
            throw new SecretResolutionException(SecretErrorKind.SECRET_NOT_RESOLVED, ref.name,
                "secret " + ref.name + " is required but no value provided");
        }
        return value;
    }
}
