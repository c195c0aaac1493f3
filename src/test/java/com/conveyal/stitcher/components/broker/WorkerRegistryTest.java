package com.conveyal.stitcher.components.broker;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

class WorkerRegistryTest {

    @Test
    void addOnlyNewHosts () {
        WorkerRegistry registry = new WorkerRegistry();
        Assertions.assertTrue(registry.add("a:8888"));
        Assertions.assertFalse(registry.add("a:8888"));
        Assertions.assertEquals(1, registry.counts().ready);
        Assertions.assertEquals(0, registry.counts().running);
    }

    @Test
    void addDoesNotResetRunningHost () throws Exception {
        WorkerRegistry registry = new WorkerRegistry();
        registry.add("a:8888");
        Assertions.assertEquals("a:8888", registry.acquireReady());
        Assertions.assertFalse(registry.add("a:8888"));
        Assertions.assertEquals(Set.of("a:8888"), registry.runningHosts());
        Assertions.assertTrue(registry.readyHosts().isEmpty());
    }

    @Test
    void acquireAndRelease () throws Exception {
        WorkerRegistry registry = new WorkerRegistry();
        registry.add("a:8888");
        registry.add("b:8888");
        String first = registry.acquireReady();
        String second = registry.acquireReady();
        Assertions.assertNotEquals(first, second);
        Assertions.assertEquals(2, registry.counts().running);
        Assertions.assertEquals(0, registry.counts().ready);

        registry.release(first);
        Assertions.assertEquals(Set.of(first), registry.readyHosts());
        Assertions.assertEquals(Set.of(second), registry.runningHosts());
    }

    /** Releasing a host that was not running makes it ready, for example after it was swept and rediscovered. */
    @Test
    void releaseUntrackedHost () {
        WorkerRegistry registry = new WorkerRegistry();
        registry.release("a:8888");
        Assertions.assertEquals(Set.of("a:8888"), registry.readyHosts());
        Assertions.assertEquals(1, registry.counts().total());
    }

    /** A host dropped while running stays dropped when its job finishes, but a rediscovered one stays ready. */
    @Test
    void releaseIfTracked () throws Exception {
        WorkerRegistry registry = new WorkerRegistry();
        registry.add("a:8888");
        String host = registry.acquireReady();
        registry.reconcile(Set.of());
        Assertions.assertFalse(registry.releaseIfTracked(host));
        Assertions.assertEquals(0, registry.counts().total());

        registry.add("b:8888");
        String other = registry.acquireReady();
        Assertions.assertTrue(registry.releaseIfTracked(other));
        Assertions.assertEquals(Set.of("b:8888"), registry.readyHosts());

        registry.reconcile(Set.of("b:8888"));
        Assertions.assertTrue(registry.releaseIfTracked("b:8888"));
        Assertions.assertEquals(Set.of("b:8888"), registry.readyHosts());
        Assertions.assertEquals(1, registry.counts().total());
    }

    @Test
    void removeFromEitherState () throws Exception {
        WorkerRegistry registry = new WorkerRegistry();
        registry.add("a:8888");
        registry.add("b:8888");
        String running = registry.acquireReady();
        String ready = running.equals("a:8888") ? "b:8888" : "a:8888";
        Assertions.assertTrue(registry.remove(running));
        Assertions.assertTrue(registry.remove(ready));
        Assertions.assertFalse(registry.remove(ready));
        Assertions.assertEquals(0, registry.counts().total());
    }

    @Test
    void acquireBlocksUntilHostAdded () throws Exception {
        WorkerRegistry registry = new WorkerRegistry();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<String> acquired = executor.submit(registry::acquireReady);
            Assertions.assertThrows(TimeoutException.class, () -> acquired.get(200, TimeUnit.MILLISECONDS));
            registry.add("a:8888");
            Assertions.assertEquals("a:8888", acquired.get(5, TimeUnit.SECONDS));
            Assertions.assertEquals(Set.of("a:8888"), registry.runningHosts());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void acquireBlocksUntilHostReleased () throws Exception {
        WorkerRegistry registry = new WorkerRegistry();
        registry.add("a:8888");
        registry.acquireReady();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<String> acquired = executor.submit(registry::acquireReady);
            Assertions.assertThrows(TimeoutException.class, () -> acquired.get(200, TimeUnit.MILLISECONDS));
            registry.release("a:8888");
            Assertions.assertEquals("a:8888", acquired.get(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void acquireIsInterruptible () throws Exception {
        WorkerRegistry registry = new WorkerRegistry();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        Future<String> acquired = executor.submit(registry::acquireReady);
        Thread.sleep(100);
        executor.shutdownNow();
        ExecutionException e = Assertions.assertThrows(ExecutionException.class,
                () -> acquired.get(5, TimeUnit.SECONDS));
        Assertions.assertTrue(e.getCause() instanceof InterruptedException);
    }

    /** Many threads acquiring at once never get the same host, and never get more hosts than exist. */
    @Test
    void concurrentAcquireIsExclusive () throws Exception {
        final int nHosts = 20;
        WorkerRegistry registry = new WorkerRegistry();
        ExecutorService executor = Executors.newFixedThreadPool(nHosts + 5);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<String>> futures = new ArrayList<>();
            for (int i = 0; i < nHosts + 5; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return registry.acquireReady();
                }));
            }
            for (int i = 0; i < nHosts; i++) {
                registry.add("host" + i + ":8888");
            }
            start.countDown();
            Set<String> acquired = new HashSet<>();
            int nBlocked = 0;
            for (Future<String> future : futures) {
                try {
                    Assertions.assertTrue(acquired.add(future.get(1, TimeUnit.SECONDS)));
                } catch (TimeoutException e) {
                    nBlocked += 1;
                }
            }
            Assertions.assertEquals(nHosts, acquired.size());
            Assertions.assertEquals(5, nBlocked);
            Assertions.assertEquals(nHosts, registry.counts().running);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void reconcileSetAlgebra () throws Exception {
        WorkerRegistry registry = new WorkerRegistry();
        registry.add("a");
        registry.add("c");
        String running = registry.acquireReady();
        String ready = running.equals("a") ? "c" : "a";
        registry.add("b");

        // Keep b and the running host, lose the other ready host, discover d.
        Set<String> dead = registry.reconcile(List.of("b", running, "d"));
        Assertions.assertEquals(Set.of(ready), dead);
        Assertions.assertEquals(Set.of("b", "d"), registry.readyHosts());
        Assertions.assertEquals(Set.of(running), registry.runningHosts());

        // Losing everything reports every tracked host, running or not.
        dead = registry.reconcile(List.of());
        Assertions.assertEquals(Set.of("b", "d", running), dead);
        Assertions.assertEquals(0, registry.counts().total());
    }

    @Test
    void reconcileWakesWaiters () throws Exception {
        WorkerRegistry registry = new WorkerRegistry();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<String> acquired = executor.submit(registry::acquireReady);
            Thread.sleep(100);
            registry.reconcile(List.of("a"));
            Assertions.assertEquals("a", acquired.get(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void countsAreConsistentUnderChurn () {
        WorkerRegistry registry = new WorkerRegistry();
        Assertions.assertTimeoutPreemptively(Duration.ofSeconds(10), () -> {
            for (int i = 0; i < 1000; i++) {
                registry.add("h" + (i % 10));
                String host = registry.acquireReady();
                if (i % 3 == 0) {
                    registry.remove(host);
                } else {
                    registry.release(host);
                }
                WorkerCounts counts = registry.counts();
                Assertions.assertTrue(counts.total() <= 10);
                Assertions.assertEquals(0, counts.running);
            }
        });
    }

}
