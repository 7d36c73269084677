package kvlite.client;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import kvlite.commands.CommandException;
import kvlite.protocol.RespCodec;
import kvlite.protocol.RespFrameScanner;
import kvlite.protocol.RespType;
import kvlite.protocol.RespValue;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.ArrayList;
import java.util.List;

/**
 * Blocking client speaking the same wire format as the server. One request is in flight at a time.
 * <p>
 * {@link #execute} hands back error replies as values; the typed helpers ({@link #get},
 * {@link #set}, ...) turn them into {@link CommandException}.
 */
public class KvClient implements Closeable {
    private static final int READ_CHUNK = 8192;

    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;
    private final RespCodec codec;
    private final RespFrameScanner scanner;
    private final ByteBuf inbound = Unpooled.buffer();

    public KvClient(String host, int port) throws IOException {
        this(host, port, 0);
    }

    /**
     * @param soTimeoutMillis read timeout, 0 waits forever
     */
    public KvClient(String host, int port, int soTimeoutMillis) throws IOException {
        this(host, port, soTimeoutMillis, new RespCodec());
    }

    public KvClient(String host, int port, int soTimeoutMillis, RespCodec codec) throws IOException {
        this.codec = codec;
        this.scanner = new RespFrameScanner(codec);
        this.socket = new Socket();
        try {
            socket.setTcpNoDelay(true);
            socket.setSoTimeout(soTimeoutMillis);
            socket.connect(new InetSocketAddress(host, port), soTimeoutMillis);
            this.in = socket.getInputStream();
            this.out = socket.getOutputStream();
        } catch (IOException e) {
            socket.close();
            inbound.release();
            throw e;
        }
    }

    /**
     * Sends a command as an array of bulk strings and waits for its reply.
     */
    public synchronized RespValue execute(String... args) throws IOException {
        List<RespValue> parts = new ArrayList<>(args.length);
        for (String arg : args) {
            parts.add(RespValue.bulkString(arg));
        }
        return send(RespValue.array(parts));
    }

    /**
     * Sends any request value and waits for its reply.
     */
    public synchronized RespValue send(RespValue request) throws IOException {
        out.write(codec.encode(request));
        out.flush();
        return readReply();
    }

    private RespValue readReply() throws IOException {
        while (true) {
            if (scanner.scan(inbound) >= 0) {
                RespValue reply = codec.decode(inbound);
                inbound.discardReadBytes();
                return reply;
            }
            if (inbound.writeBytes(in, READ_CHUNK) < 0) {
                throw new DisconnectException("Connection closed by server");
            }
        }
    }

    // --- TYPED HELPERS ---

    public String get(String key) throws IOException {
        return asBulk(execute("GET", key)).asString();
    }

    public long set(String key, String value) throws IOException {
        return asInteger(execute("SET", key, value));
    }

    public boolean delete(String key) throws IOException {
        return asInteger(execute("DELETE", key)) == 1;
    }

    public long flush() throws IOException {
        return asInteger(execute("FLUSH"));
    }

    public List<String> mget(String... keys) throws IOException {
        String[] args = new String[keys.length + 1];
        args[0] = "MGET";
        System.arraycopy(keys, 0, args, 1, keys.length);

        RespValue reply = check(execute(args));
        if (reply.type() != RespType.ARRAY) throw unexpected(reply);
        List<String> values = new ArrayList<>();
        for (RespValue element : ((RespValue.RespArray) reply).getElements()) {
            values.add(asBulk(element).asString());
        }
        return values;
    }

    public long mset(String... keysAndValues) throws IOException {
        String[] args = new String[keysAndValues.length + 1];
        args[0] = "MSET";
        System.arraycopy(keysAndValues, 0, args, 1, keysAndValues.length);
        return asInteger(execute(args));
    }

    private static RespValue check(RespValue reply) {
        if (reply.type() == RespType.ERROR) {
            throw new CommandException(((RespValue.RespError) reply).getMessage());
        }
        return reply;
    }

    private static RespValue.BulkString asBulk(RespValue reply) {
        if (check(reply).type() != RespType.BULK_STRING) throw unexpected(reply);
        return (RespValue.BulkString) reply;
    }

    private static long asInteger(RespValue reply) {
        if (check(reply).type() != RespType.INTEGER) throw unexpected(reply);
        return ((RespValue.RespInteger) reply).getValue();
    }

    private static IllegalStateException unexpected(RespValue reply) {
        return new IllegalStateException("Unexpected reply: " + reply);
    }

    public boolean isConnected() {
        return socket.isConnected() && !socket.isClosed();
    }

    @Override
    public synchronized void close() throws IOException {
        try {
            socket.close();
        } finally {
            if (inbound.refCnt() > 0) inbound.release();
        }
    }
}
