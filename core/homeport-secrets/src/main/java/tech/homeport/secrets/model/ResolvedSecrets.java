package tech.homeport.secrets.model;

import tech.homeport.secrets.envfile.EnvFiles;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * In-memory collection of resolved secrets keyed by name. Never serialized.
 * Call {@link #clear()} once the values have been handed to the deployment.
 */
public final class ResolvedSecrets {

    private final Map<String, ResolvedSecret> secrets = new LinkedHashMap<>();

    public synchronized void add(SecretReference reference, String value, String resolvedFrom) {
        ResolvedSecret previous = secrets.put(reference.name,
            new ResolvedSecret(reference, value, resolvedFrom, Instant.now()));
        if (previous != null) {
            previous.destroy();
        }
    }

    public synchronized Optional<ResolvedSecret> get(String name) {
        return Optional.ofNullable(secrets.get(name));
    }

    public Optional<String> getValue(String name) {
        return get(name).map(ResolvedSecret::value);
    }

    public synchronized boolean has(String name) {
        return secrets.containsKey(name);
    }

    /**
     * Names in sorted order.
     */
    public synchronized List<String> names() {
        List<String> names = new ArrayList<>(secrets.keySet());
        Collections.sort(names);
        return names;
    }

    public synchronized int count() {
        return secrets.size();
    }

    /**
     * Name to value map, sorted by name.
     */
    public synchronized Map<String, String> toEnvMap() {
        Map<String, String> env = new TreeMap<>();
        secrets.forEach((name, secret) -> env.put(name, secret.value()));
        return env;
    }

    /**
     * {@code NAME=value} lines sorted by name, values quoted and escaped where needed.
     */
    public String toEnvFile() {
        StringBuilder sb = new StringBuilder();
        toEnvMap().forEach((name, value) ->
            sb.append(name).append('=').append(EnvFiles.escapeValue(value)).append('\n'));
        return sb.toString();
    }

    /**
     * Overwrite every value and remove all entries.
     */
    public synchronized void clear() {
        secrets.values().forEach(ResolvedSecret::destroy);
        secrets.clear();
    }

    @Override
    public synchronized String toString() {
        return "ResolvedSecrets{names=" + names() + "}";
    }
}
