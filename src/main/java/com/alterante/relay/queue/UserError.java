package com.alterante.relay.queue;

/**
 * A failure worth showing to the user: a short title plus a raw description.
 * Formatting and localization belong to whoever displays it.
 */
public record UserError(String title, String message) {

    public static final UserError UNDEFINED = new UserError(
            "Unexpected Error Occurred",
            "An error occurred during execution due to an undefined error message!");

    @Override
    public String toString() {
        return title + ": " + message;
    }
}
