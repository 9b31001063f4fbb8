package tech.homeport.secrets.resolve.clients;

/**
 * Outcome of an external command. Stdout may hold a secret value.
 */
public record CommandResult(int exitCode, String stdout, String stderr, boolean timedOut) {

    public boolean isSuccess() {
        return !timedOut && exitCode == 0;
    }

    @Override
    public String toString() {
        return "CommandResult{exitCode=" + exitCode + ", timedOut=" + timedOut + "}";
    }
}
