package tech.homeport.secrets.resolve.providers;

import java.io.IOException;

/**
 * Operator terminal used for prompting.
 */
public interface Terminal {

    /**
     * Whether an operator can answer prompts.
     */
    boolean isInteractive();

    void print(String text);

    /**
     * Read one line with echo. Returns null at end of input.
     */
    String readLine() throws IOException;

    /**
     * Read one line without echo. Returns null at end of input.
     */
    String readHidden() throws IOException;
}
