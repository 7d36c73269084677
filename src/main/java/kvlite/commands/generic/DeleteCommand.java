package kvlite.commands.generic;

import kvlite.commands.Command;
import kvlite.db.KeyValueStore;
import kvlite.protocol.RespValue;

import java.util.List;

public class DeleteCommand implements Command {
    @Override
    public RespValue execute(KeyValueStore store, List<byte[]> args) {
        return RespValue.integer(store.delete(args.get(1)) ? 1 : 0);
    }
}
