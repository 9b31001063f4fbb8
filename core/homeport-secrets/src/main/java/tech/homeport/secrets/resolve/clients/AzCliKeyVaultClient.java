package tech.homeport.secrets.resolve.clients;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link AzureKeyVaultClient} on the {@code az} CLI.
 */
public class AzCliKeyVaultClient extends AbstractCliClient implements AzureKeyVaultClient {

    private final String subscription;

    public AzCliKeyVaultClient(String binary, String subscription, CommandRunner runner) {
        super(binary, runner);
        this.subscription = subscription;
    }

    @Override
    public String getSecret(String vaultName, String secretName, String version, Duration timeout) {
        List<String> args = new ArrayList<>(List.of(
            "keyvault", "secret", "show",
            "--vault-name", vaultName,
            "--name", secretName,
            "--query", "value",
            "--output", "tsv"));
        if (version != null && !version.isEmpty()) {
            args.add("--version");
            args.add(version);
        }
        addSubscription(args);
        return fetch(secretName, timeout, args);
    }

    @Override
    public List<String> listSecrets(String vaultName, Duration timeout) {
        List<String> args = new ArrayList<>(List.of(
            "keyvault", "secret", "list",
            "--vault-name", vaultName,
            "--query", "[].name",
            "--output", "tsv"));
        addSubscription(args);
        return fetchLines("secret list of vault " + vaultName, timeout, args);
    }

    @Override
    public List<String> listVaults(Duration timeout) {
        List<String> args = new ArrayList<>(List.of("keyvault", "list", "--query", "[].name", "--output", "tsv"));
        addSubscription(args);
        return fetchLines("vault list", timeout, args);
    }

    @Override
    public void verifyAccess() {
        List<String> args = new ArrayList<>(List.of("account", "show", "--output", "none"));
        addSubscription(args);
        verify(args);
    }

    private void addSubscription(List<String> args) {
        if (subscription != null && !subscription.isEmpty()) {
            args.add("--subscription");
            args.add(subscription);
        }
    }
}
