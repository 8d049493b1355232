package org.trypticon.dismax.cli;

/**
 * Constants for the command-line interface.
 */
final class Constants {
    /**
     * The name the application is launched under.
     */
    static final String APP_NAME = "dismax";

    private Constants() {
    }
}
