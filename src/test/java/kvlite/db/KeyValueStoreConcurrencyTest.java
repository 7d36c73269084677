package kvlite.db;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class KeyValueStoreConcurrencyTest {

    private static byte[] b(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    public void testMsetIsObservedAtomicallyByMget() throws Exception {
        KeyValueStore store = new KeyValueStore();
        store.mset(Arrays.asList(b("x"), b("0"), b("y"), b("0")));

        ExecutorService es = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger torn = new AtomicInteger();

        Future<?> writer = es.submit(() -> {
            start.await();
            for (int i = 1; i <= 5000; i++) {
                String v = Integer.toString(i);
                store.mset(Arrays.asList(b("x"), b(v), b("y"), b(v)));
            }
            return null;
        });

        List<Future<?>> readers = new ArrayList<>();
        for (int r = 0; r < 3; r++) {
            readers.add(es.submit(() -> {
                start.await();
                for (int i = 0; i < 5000; i++) {
                    List<byte[]> values = store.mget(Arrays.asList(b("x"), b("y")));
                    if (!Arrays.equals(values.get(0), values.get(1))) {
                        torn.incrementAndGet();
                    }
                }
                return null;
            }));
        }

        start.countDown();
        writer.get(30, TimeUnit.SECONDS);
        for (Future<?> reader : readers) {
            reader.get(30, TimeUnit.SECONDS);
        }
        es.shutdown();

        assertEquals(0, torn.get(), "MGET must never see half of an MSET");
        assertArrayEquals(b("5000"), store.get(b("x")));
    }

    @Test
    public void testDisjointWritersLoseNothing() throws Exception {
        KeyValueStore store = new KeyValueStore();
        int threads = 8;
        int perThread = 1000;

        ExecutorService es = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            final int id = t;
            futures.add(es.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    store.set(b("t" + id + ":" + i), b(Integer.toString(i)));
                }
                return null;
            }));
        }

        start.countDown();
        for (Future<?> f : futures) {
            f.get(30, TimeUnit.SECONDS);
        }
        es.shutdown();

        assertEquals(threads * perThread, store.size());
        assertArrayEquals(b("999"), store.get(b("t7:999")));
    }

    @Test
    public void testFlushCountsEveryKeyExactlyOnce() throws Exception {
        KeyValueStore store = new KeyValueStore();
        int keys = 2000;
        for (int i = 0; i < keys; i++) {
            store.set(b("k" + i), b("v"));
        }

        ExecutorService es = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> flushes = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            flushes.add(es.submit(() -> {
                start.await();
                return store.flush();
            }));
        }

        start.countDown();
        int total = 0;
        for (Future<Integer> f : flushes) {
            total += f.get(30, TimeUnit.SECONDS);
        }
        es.shutdown();

        assertEquals(keys, total);
        assertEquals(0, store.size());
    }
}
