package tech.homeport.secrets.resolve;

public enum ResolvabilityState {
    /** Value present in the secrets file or environment. */
    RESOLVABLE("resolvable"),
    /** A provider reports a usable configuration. */
    MAYBE_RESOLVABLE("maybe"),
    /** Only the interactive prompt is left. */
    NEEDS_INTERACTIVE("interactive"),
    UNRESOLVABLE("unresolvable");

    private final String value;

    ResolvabilityState(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
