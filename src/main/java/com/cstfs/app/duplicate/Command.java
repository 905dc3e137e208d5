package com.cstfs.app.duplicate;

import java.util.Locale;

/**
 * Operator answer to a duplicate prompt. Parsing is a pure function of one
 * input line, so the grammar can be exercised without a console.
 */
public enum Command {
    /** Empty line or {@code y}: delete the new file, keep the index as is. */
    REMOVE_NEW,
    /** {@code n}: stop the whole run. */
    ABORT,
    /** {@code s}: reserved for an ignore list that does not exist yet. */
    IGNORE,
    /** {@code o}: delete the old file and point the index at the new one. */
    REMOVE_OLD,
    /** {@code ?}: print the grammar and ask again. */
    HELP,
    /** Anything else: complain and ask again. */
    INVALID;

    public static final String VALID_COMMANDS = "Y/n/s/o/?";

    public static final String HELP_TEXT = """
        y(Yes)  - Remove the new file
        n(No)   - Do not remove the file and quit the program
        s(Skip) - Skip the file and add it to the ignorelist
        o(Old)  - Remove the old file and keep the new one
        ?(Help) - Print this message""";

    public static Command parse(String line) {
        String input = line == null ? "" : line.trim().toLowerCase(Locale.ROOT);
        return switch (input) {
            case "", "y" -> REMOVE_NEW;
            case "n" -> ABORT;
            case "s" -> IGNORE;
            case "o" -> REMOVE_OLD;
            case "?" -> HELP;
            default -> INVALID;
        };
    }

    /**
     * Whether the prompt asks for another line after this command.
     */
    public boolean reprompts() {
        return this == HELP || this == INVALID;
    }
}
