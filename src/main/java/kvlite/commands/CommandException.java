package kvlite.commands;

/**
 * A semantically invalid request: unknown command, wrong arity, wrong request shape.
 * Recoverable; the connection answers with an error value and stays open.
 */
public class CommandException extends RuntimeException {

    public CommandException(String message) {
        super(message);
    }
}
