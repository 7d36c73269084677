package kvlite.commands;

import kvlite.commands.generic.DeleteCommand;
import kvlite.commands.server.FlushCommand;
import kvlite.commands.string.GetCommand;
import kvlite.commands.string.MGetCommand;
import kvlite.commands.string.MSetCommand;
import kvlite.commands.string.SetCommand;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Name to command table, built once when the class loads and shared by every connection.
 */
public final class CommandRegistry {
    private static final Map<String, CommandContainer> commands;

    static {
        Map<String, CommandContainer> table = new HashMap<>();
        register(table, "GET", new GetCommand(), 2);
        register(table, "SET", new SetCommand(), 3);
        register(table, "DELETE", new DeleteCommand(), 2);
        register(table, "FLUSH", new FlushCommand(), 1);
        register(table, "MGET", new MGetCommand(), -1);
        register(table, "MSET", new MSetCommand(), -1);
        commands = Collections.unmodifiableMap(table);
    }

    private CommandRegistry() { }

    private static void register(Map<String, CommandContainer> table, String name, Command command, int arity) {
        table.put(name, new CommandContainer(name, command, new CommandMetadata(arity)));
    }

    /**
     * @param name upper-case command name
     * @return the command, or null if the name is unknown
     */
    public static CommandContainer get(String name) {
        return commands.get(name);
    }

    public static Set<String> names() {
        return commands.keySet();
    }
}
