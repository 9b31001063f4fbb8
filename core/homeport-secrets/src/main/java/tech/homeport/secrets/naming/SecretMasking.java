package tech.homeport.secrets.naming;

/**
 * Masking for values and locators that end up in logs or on the terminal.
 */
public final class SecretMasking {

    private SecretMasking() {
    }

    /**
     * Show the first two and last two characters only. Values of four
     * characters or fewer are fully masked.
     */
    public static String maskValue(String value) {
        if (value == null || value.isEmpty()) {
            return "(empty)";
        }
        if (value.length() <= 4) {
            return "****";
        }
        return value.substring(0, 2) + "*".repeat(value.length() - 4)
            + value.substring(value.length() - 2);
    }

    /**
     * Keep the scheme of a locator (e.g. {@code arn:}, {@code https://}) and hide the rest.
     */
    public static String maskReference(String reference) {
        if (reference == null || reference.isEmpty()) {
            return "***";
        }
        int schemeEnd = reference.indexOf("://");
        if (schemeEnd > 0 && schemeEnd < 15) {
            return reference.substring(0, schemeEnd + 3) + "***";
        }
        int colon = reference.indexOf(':');
        if (colon > 0 && colon < 15) {
            return reference.substring(0, colon + 1) + "***";
        }
        return "***";
    }
}
