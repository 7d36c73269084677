package kvlite.server;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import kvlite.Config;
import kvlite.client.KvClient;
import kvlite.commands.CommandException;
import kvlite.protocol.RespCodec;
import kvlite.protocol.RespValue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.*;
import java.util.logging.Handler;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

public class KvServerTest {

    private static final String HOST = "127.0.0.1";
    private static final int TIMEOUT = 5000;
    // Held so the handler stays attached while a test runs
    private static final Logger NETTY_LOGGER = Logger.getLogger("io.netty");

    private KvServer server;

    private KvServer startServer(int maxClients) throws InterruptedException {
        Config config = new Config();
        config.port = 0;
        config.maxClients = maxClients;
        config.workerThreads = 2;
        server = new KvServer(config);
        server.start();
        return server;
    }

    @AfterEach
    public void tearDown() {
        if (server != null) server.stop();
    }

    private static RespValue readReply(InputStream in) throws IOException {
        RespCodec codec = new RespCodec();
        ByteBuf buf = Unpooled.buffer();
        try {
            while (true) {
                RespValue reply = codec.decode(buf);
                if (reply != null) return reply;
                int b = in.read();
                if (b < 0) return null;
                buf.writeByte(b);
            }
        } finally {
            buf.release();
        }
    }

    private static void write(Socket socket, String data) throws IOException {
        OutputStream out = socket.getOutputStream();
        out.write(data.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    @Test
    public void testEndToEnd() throws Exception {
        startServer(8);
        try (KvClient client = new KvClient(HOST, server.getPort(), TIMEOUT)) {
            assertNull(client.get("foo"));
            assertEquals(1, client.set("foo", "bar"));
            assertEquals("bar", client.get("foo"));
            assertTrue(client.delete("foo"));
            assertFalse(client.delete("foo"));

            assertEquals(2, client.mset("a", "1", "b", "2"));
            assertEquals(Arrays.asList("1", "2", null), client.mget("a", "b", "c"));
            assertEquals(2, client.flush());
            assertEquals(0, server.getStore().size());
        }
        assertEquals(8, server.getTotalCommands());
    }

    @Test
    public void testUnknownCommandKeepsConnectionUsable() throws Exception {
        startServer(8);
        try (KvClient client = new KvClient(HOST, server.getPort(), TIMEOUT)) {
            assertEquals(RespValue.error("unrecognized command: FOO"), client.execute("FOO", "x"));

            CommandException e = assertThrows(CommandException.class, () -> client.mset("a", "1", "b"));
            assertEquals("MSET requires an even number of key/value arguments", e.getMessage());

            assertEquals(1, client.set("k", "v"));
            assertEquals("v", client.get("k"));
        }
    }

    @Test
    public void testMalformedLengthClosesWithoutResponse() throws Exception {
        startServer(8);
        try (Socket socket = new Socket(HOST, server.getPort())) {
            socket.setSoTimeout(TIMEOUT);
            write(socket, "$abc\r\n");

            assertEquals(-1, socket.getInputStream().read());
        }
    }

    @Test
    public void testPipelinedRequestsOverRawSocket() throws Exception {
        startServer(8);
        try (Socket socket = new Socket(HOST, server.getPort())) {
            socket.setSoTimeout(TIMEOUT);
            write(socket, "*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$2\r\nv1\r\n"
                    + "+GET k\r\n"
                    + "*1\r\n$5\r\nFLUSH\r\n");

            InputStream in = socket.getInputStream();
            assertEquals(RespValue.integer(1), readReply(in));
            assertEquals(RespValue.bulkString("v1"), readReply(in));
            assertEquals(RespValue.integer(1), readReply(in));
        }
    }

    @Test
    public void testExtraClientWaitsForFreeSlot() throws Exception {
        startServer(1);
        try (KvClient first = new KvClient(HOST, server.getPort(), TIMEOUT);
             Socket second = new Socket(HOST, server.getPort())) {
            assertEquals(1, first.set("k", "v"));

            second.setSoTimeout(500);
            write(second, "*2\r\n$3\r\nGET\r\n$1\r\nk\r\n");
            InputStream in = second.getInputStream();
            assertThrows(SocketTimeoutException.class, in::read, "second client should not be served yet");
            assertEquals(1, server.getActiveConnections());

            first.close();

            second.setSoTimeout(TIMEOUT);
            assertEquals(RespValue.bulkString("v"), readReply(in));
        }
    }

    @Test
    public void testConcurrentClientsOnDisjointKeys() throws Exception {
        startServer(16);
        int clients = 8;
        int perClient = 100;

        ExecutorService es = Executors.newFixedThreadPool(clients);
        List<Future<Integer>> futures = new ArrayList<>();
        for (int c = 0; c < clients; c++) {
            final int id = c;
            futures.add(es.submit(() -> {
                int verified = 0;
                try (KvClient client = new KvClient(HOST, server.getPort(), TIMEOUT)) {
                    for (int i = 0; i < perClient; i++) {
                        client.set("c" + id + ":" + i, "v" + i);
                    }
                    for (int i = 0; i < perClient; i++) {
                        if (("v" + i).equals(client.get("c" + id + ":" + i))) verified++;
                    }
                }
                return verified;
            }));
        }

        for (Future<Integer> f : futures) {
            assertEquals(perClient, f.get(30, TimeUnit.SECONDS));
        }
        es.shutdown();
        assertEquals(clients * perClient, server.getStore().size());
    }

    @Test
    public void testStartTwiceFailsAndStopIsIdempotent() throws Exception {
        startServer(1);
        assertThrows(IllegalStateException.class, () -> server.start());

        server.stop();
        server.stop();
        assertThrows(IllegalStateException.class, () -> server.getPort());
        server = null;
    }

    @Test
    public void testStopWithConnectedClientsLogsNoRejectedTasks() throws Exception {
        List<LogRecord> records = new CopyOnWriteArrayList<>();
        Handler capture = new Handler() {
            @Override
            public void publish(LogRecord record) {
                records.add(record);
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        NETTY_LOGGER.addHandler(capture);
        try {
            startServer(4);
            try (KvClient a = new KvClient(HOST, server.getPort(), TIMEOUT);
                 KvClient b = new KvClient(HOST, server.getPort(), TIMEOUT)) {
                assertEquals(1, a.set("a", "1"));
                assertEquals(1, b.set("b", "2"));

                server.stop();
            }
            server = null;
        } finally {
            NETTY_LOGGER.removeHandler(capture);
        }

        for (LogRecord record : records) {
            Throwable t = record.getThrown();
            while (t != null) {
                assertFalse(t instanceof RejectedExecutionException, "rejected task logged: " + record.getMessage());
                t = t.getCause();
            }
        }
    }
}
