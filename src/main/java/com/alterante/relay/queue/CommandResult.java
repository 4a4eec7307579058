package com.alterante.relay.queue;

/**
 * Outcome of one {@link Command#execute} invocation.
 *
 * @param success   whether the command did its work
 * @param retryable for failures: whether running it again may help
 * @param error     optional user-facing error, may be null
 */
public record CommandResult(boolean success, boolean retryable, UserError error) {

    private static final CommandResult SUCCESS = new CommandResult(true, false, null);

    public static CommandResult ok() {
        return SUCCESS;
    }

    public static CommandResult retry(UserError error) {
        return new CommandResult(false, true, error);
    }

    public static CommandResult fail(UserError error) {
        return new CommandResult(false, false, error);
    }
}
