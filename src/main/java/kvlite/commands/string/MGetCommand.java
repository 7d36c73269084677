package kvlite.commands.string;

import kvlite.commands.Command;
import kvlite.db.KeyValueStore;
import kvlite.protocol.RespValue;

import java.util.ArrayList;
import java.util.List;

public class MGetCommand implements Command {
    @Override
    public RespValue execute(KeyValueStore store, List<byte[]> args) {
        List<byte[]> values = store.mget(args.subList(1, args.size()));
        List<RespValue> results = new ArrayList<>(values.size());
        for (byte[] value : values) {
            results.add(RespValue.bulkString(value));
        }
        return RespValue.array(results);
    }
}
