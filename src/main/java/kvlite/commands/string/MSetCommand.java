package kvlite.commands.string;

import kvlite.commands.Command;
import kvlite.commands.CommandException;
import kvlite.db.KeyValueStore;
import kvlite.protocol.RespValue;

import java.util.List;

public class MSetCommand implements Command {
    @Override
    public RespValue execute(KeyValueStore store, List<byte[]> args) {
        List<byte[]> pairs = args.subList(1, args.size());
        if (pairs.size() % 2 != 0) {
            throw new CommandException("MSET requires an even number of key/value arguments");
        }
        return RespValue.integer(store.mset(pairs));
    }
}
