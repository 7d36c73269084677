package kvlite.commands;

public class CommandMetadata {
    // Positive: exact argument count including the command name. Negative: minimum count.
    private final int arity;

    public CommandMetadata(int arity) {
        this.arity = arity;
    }

    public int getArity() {
        return arity;
    }

    public boolean acceptsArgumentCount(int count) {
        return arity >= 0 ? count == arity : count >= -arity;
    }
}
