package kvlite.commands;

import kvlite.db.KeyValueStore;
import kvlite.protocol.RespValue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns a decoded request into a command invocation against the store.
 * <p>
 * A request is an array whose first element names the command, or, as a convenience, a simple
 * string holding the name and arguments separated by whitespace.
 */
public class CommandDispatcher {

    private final KeyValueStore store;

    public CommandDispatcher(KeyValueStore store) {
        this.store = store;
    }

    /**
     * @return the reply produced by the command
     * @throws CommandException if the request is not a valid command
     */
    public RespValue dispatch(RespValue request) {
        List<byte[]> parts = toArguments(request);
        if (parts.isEmpty()) {
            throw new CommandException("missing command");
        }

        String cmd = new String(parts.get(0), StandardCharsets.UTF_8).toUpperCase(Locale.ROOT);
        CommandContainer container = CommandRegistry.get(cmd);
        if (container == null) {
            throw new CommandException("unrecognized command: " + cmd);
        }
        if (!container.getMetadata().acceptsArgumentCount(parts.size())) {
            throw new CommandException("wrong number of arguments for '" + cmd.toLowerCase(Locale.ROOT) + "' command");
        }
        return container.getCommand().execute(store, parts);
    }

    static List<byte[]> toArguments(RespValue request) {
        switch (request.type()) {
            case ARRAY:
                List<RespValue> elements = ((RespValue.RespArray) request).getElements();
                List<byte[]> parts = new ArrayList<>(elements.size());
                for (RespValue element : elements) {
                    parts.add(toArgument(element));
                }
                return parts;
            case SIMPLE_STRING:
                String line = ((RespValue.SimpleString) request).getValue().trim();
                List<byte[]> tokens = new ArrayList<>();
                if (line.isEmpty()) return tokens;
                for (String token : line.split("\\s+")) {
                    tokens.add(token.getBytes(StandardCharsets.UTF_8));
                }
                return tokens;
            default:
                throw new CommandException("request must be an array or simple string");
        }
    }

    private static byte[] toArgument(RespValue element) {
        switch (element.type()) {
            case BULK_STRING:
                RespValue.BulkString bulk = (RespValue.BulkString) element;
                if (bulk.isNull()) {
                    throw new CommandException("invalid argument type: null bulk string");
                }
                return bulk.getBytes();
            case SIMPLE_STRING:
                return ((RespValue.SimpleString) element).getValue().getBytes(StandardCharsets.UTF_8);
            case INTEGER:
                return Long.toString(((RespValue.RespInteger) element).getValue()).getBytes(StandardCharsets.US_ASCII);
            default:
                throw new CommandException("invalid argument type: " + element.type());
        }
    }
}
