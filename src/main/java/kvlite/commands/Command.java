package kvlite.commands;

import kvlite.db.KeyValueStore;
import kvlite.protocol.RespValue;

import java.util.List;

public interface Command {
    // args.get(0) is the command name as sent; arity has already been checked by the dispatcher.
    // Returns the reply to encode, or throws CommandException to reply with an error.
    RespValue execute(KeyValueStore store, List<byte[]> args);
}
