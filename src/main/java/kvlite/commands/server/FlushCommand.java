package kvlite.commands.server;

import kvlite.commands.Command;
import kvlite.db.KeyValueStore;
import kvlite.protocol.RespValue;

import java.util.List;

public class FlushCommand implements Command {
    @Override
    public RespValue execute(KeyValueStore store, List<byte[]> args) {
        return RespValue.integer(store.flush());
    }
}
