package tech.homeport.secrets.envfile;

import tech.homeport.secrets.model.ResolvedSecrets;
import tech.homeport.secrets.model.SecretsManifest;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Reading and writing of {@code KEY=VALUE} env files.
 *
 * Values written by {@link #escapeValue(String)} parse back to the original
 * string through {@link #parse(String)}.
 */
public final class EnvFiles {

    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");

    private EnvFiles() {
    }

    /**
     * Parse env file content. Blank lines and {@code #} comments are skipped,
     * whitespace around {@code =} is ignored, one pair of matching single or
     * double quotes is stripped and escape sequences are decoded. Later
     * definitions of a key win.
     */
    public static Map<String, String> parse(String content) {
        Map<String, String> env = new LinkedHashMap<>();
        if (content == null) {
            return env;
        }
        for (String rawLine : content.split("\r?\n")) {
            String line = rawLine.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            int idx = line.indexOf('=');
            if (idx < 0) {
                continue;
            }
            String key = line.substring(0, idx).trim();
            if (key.isEmpty()) {
                continue;
            }
            String value = line.substring(idx + 1).trim();
            if (value.length() >= 2) {
                char first = value.charAt(0);
                char last = value.charAt(value.length() - 1);
                if ((first == '"' && last == '"') || (first == '\'' && last == '\'')) {
                    value = value.substring(1, value.length() - 1);
                }
            }
            env.put(key, unescape(value));
        }
        return env;
    }

    public static Map<String, String> read(Path path) throws IOException {
        return parse(Files.readString(path, StandardCharsets.UTF_8));
    }

    /**
     * Quote and escape a value when it contains whitespace, a control
     * character or one of {@code " ' \ `} or {@code $}. Backslash, double quote and dollar are
     * escaped; newline, carriage return and tab are written as {@code \n},
     * {@code \r} and {@code \t}. Other values are returned unchanged.
     */
    public static String escapeValue(String value) {
        if (value == null || value.isEmpty() || !needsQuoting(value)) {
            return value == null ? "" : value;
        }
        StringBuilder sb = new StringBuilder(value.length() + 8).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '$' -> sb.append("\\$");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    /**
     * Write resolved secrets as an env file readable by the owner only
     * (on file systems with POSIX permissions).
     */
    public static void writeResolved(ResolvedSecrets resolved, Path path) throws IOException {
        byte[] content = resolved.toEnvFile().getBytes(StandardCharsets.UTF_8);
        boolean posix = Files.getFileStore(parentOf(path)).supportsFileAttributeView("posix");

        Set<OpenOption> options = Set.of(StandardOpenOption.CREATE, StandardOpenOption.WRITE,
            StandardOpenOption.TRUNCATE_EXISTING);
        FileAttribute<?>[] attributes = posix
            ? new FileAttribute<?>[] {PosixFilePermissions.asFileAttribute(OWNER_ONLY)}
            : new FileAttribute<?>[0];

        try (SeekableByteChannel channel = Files.newByteChannel(path, options, attributes)) {
            ByteBuffer buffer = ByteBuffer.wrap(content);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
        }
        if (posix) {
            // An existing file keeps its old mode on open
            Files.setPosixFilePermissions(path, OWNER_ONLY);
        }
    }

    /**
     * Write the {@code .env.template} for a manifest.
     */
    public static void writeTemplate(SecretsManifest manifest, Path path) throws IOException {
        Files.writeString(path, manifest.generateEnvTemplate(), StandardCharsets.UTF_8);
    }

    private static boolean needsQuoting(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isWhitespace(c) || Character.isISOControl(c)
                || c == '"' || c == '\'' || c == '\\' || c == '`' || c == '$') {
                return true;
            }
        }
        return false;
    }

    private static String unescape(String value) {
        if (value.indexOf('\\') < 0) {
            return value;
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c != '\\' || i + 1 >= value.length()) {
                sb.append(c);
                continue;
            }
            char next = value.charAt(i + 1);
            switch (next) {
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case '"', '\'', '\\', '$' -> sb.append(next);
                default -> {
                    sb.append(c);
                    continue;
                }
            }
            i++;
        }
        return sb.toString();
    }

    private static Path parentOf(Path path) {
        Path parent = path.toAbsolutePath().getParent();
        return parent == null ? path.toAbsolutePath() : parent;
    }
}
