package kvlite.commands.string;

import kvlite.commands.Command;
import kvlite.db.KeyValueStore;
import kvlite.protocol.RespValue;

import java.util.List;

public class SetCommand implements Command {
    @Override
    public RespValue execute(KeyValueStore store, List<byte[]> args) {
        store.set(args.get(1), args.get(2));
        return RespValue.integer(1);
    }
}
