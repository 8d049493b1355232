package org.trypticon.dismax;

import java.io.PrintStream;
import javax.annotation.Nonnull;

/**
 * Info stream writing {@code component: line} to a print stream, for every component.
 */
public class PrintStreamInfoStream implements InfoStream {
    private final PrintStream stream;

    /**
     * Constructs the info stream.
     *
     * @param stream the stream to write messages to.
     */
    public PrintStreamInfoStream(@Nonnull PrintStream stream) {
        this.stream = stream;
    }

    @Override
    public void message(String component, String line) {
        stream.println(component + ": " + line);
    }

    @Override
    public boolean isEnabled(String component) {
        return true;
    }
}
