package tech.homeport.secrets.resolve.clients;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link GcpSecretsClient} on the {@code gcloud} CLI.
 */
public class GcloudSecretsClient extends AbstractCliClient implements GcpSecretsClient {

    public GcloudSecretsClient(String binary, CommandRunner runner) {
        super(binary, runner);
    }

    @Override
    public String accessVersion(String project, String secret, String version, Duration timeout) {
        List<String> args = new ArrayList<>(List.of("secrets", "versions", "access", version, "--secret", secret));
        if (project != null && !project.isEmpty()) {
            args.add("--project");
            args.add(project);
        }
        return fetch(secret, timeout, args);
    }

    @Override
    public void verifyAccess() {
        verify(List.of("auth", "list", "--filter=status:ACTIVE", "--format=value(account)"));
    }
}
