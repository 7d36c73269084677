package kvlite.commands.string;

import kvlite.commands.Command;
import kvlite.db.KeyValueStore;
import kvlite.protocol.RespValue;

import java.util.List;

public class GetCommand implements Command {
    @Override
    public RespValue execute(KeyValueStore store, List<byte[]> args) {
        return RespValue.bulkString(store.get(args.get(1)));
    }
}
