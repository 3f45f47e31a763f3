package io.graphvault.server.graph;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class Neo4jGraphStoreTest {

    @Test
    void queries_before_connect_fail_with_connection_error() {
        var store = new Neo4jGraphStore("bolt://localhost:1", "neo4j", "secret");

        assertFalse(store.isConnected());
        assertThrows(StoreConnectionException.class, () -> store.executeQuery("RETURN 1", Map.of()));
        assertThrows(StoreConnectionException.class, () -> store.executeWrite(CypherStatements.CLEAR_ALL, Map.of()));
    }

    @Test
    void close_from_many_threads_leaves_store_disconnected() throws Exception {
        var store = new Neo4jGraphStore("bolt://localhost:1", "neo4j", "secret");
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    store.close();
                    assertThrows(StoreConnectionException.class, () -> store.executeQuery("RETURN 1", Map.of()));
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertFalse(store.isConnected());
    }
}
