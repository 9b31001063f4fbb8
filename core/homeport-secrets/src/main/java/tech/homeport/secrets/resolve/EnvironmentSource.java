package tech.homeport.secrets.resolve;

import java.util.Map;
import java.util.Optional;

/**
 * Read access to environment variables. Inject {@link #of(Map)} in tests.
 */
@FunctionalInterface
public interface EnvironmentSource {

    Optional<String> get(String name);

    static EnvironmentSource system() {
        return name -> Optional.ofNullable(System.getenv(name));
    }

    static EnvironmentSource of(Map<String, String> variables) {
        Map<String, String> snapshot = Map.copyOf(variables);
        return name -> Optional.ofNullable(snapshot.get(name));
    }
}
