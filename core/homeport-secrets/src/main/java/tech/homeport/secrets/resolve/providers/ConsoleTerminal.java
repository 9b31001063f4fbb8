package tech.homeport.secrets.resolve.providers;

import java.io.BufferedReader;
import java.io.Console;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * {@link Terminal} on the process console. Hidden input needs a real console;
 * without one it falls back to standard input with echo.
 */
public class ConsoleTerminal implements Terminal {

    private final Console console;
    private final BufferedReader stdin;
    private final PrintStream out;

    public ConsoleTerminal() {
        this.console = System.console();
        this.stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        this.out = System.out;
    }

    @Override
    public boolean isInteractive() {
        return console != null;
    }

    @Override
    public void print(String text) {
        out.print(text);
        out.flush();
    }

    @Override
    public String readLine() throws IOException {
        if (console != null) {
            return console.readLine();
        }
        return stdin.readLine();
    }

    @Override
    public String readHidden() throws IOException {
        if (console == null) {
            return stdin.readLine();
        }
        char[] chars = console.readPassword();
        if (chars == null) {
            return null;
        }
        try {
            return new String(chars);
        } finally {
            Arrays.fill(chars, '\0');
        }
    }
}
