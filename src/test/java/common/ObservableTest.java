package common;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import common.Observable.Callback;
import common.Observable.CallbackHandle;

import static org.junit.Assert.*;

public class ObservableTest {

    private static Observable observable = new Observable();

    @Before
    public void beforeEach() {
       observable.removeAllListeners();
    }

    @Test
    public void testArgsReachCallback() {
        List<Object> received = new ArrayList<>();
        Object state = new Object();

        observable.on("state_changed", args -> received.addAll(Arrays.asList(args)));
        observable.emitEvent("state_changed", state, "s1", 3);

        assertEquals(Arrays.asList(state, "s1", 3), received);
    }

    @Test
    public void testNoArgsAndNullArg() {
        observable.on("disconnected", args -> {
                                    assertNotNull(args);
                                    assertEquals(0, args.length);
                                });
        observable.emitEvent("disconnected");

        observable.on("error", Assert::assertNull);
        observable.emitEvent("error", (Object[]) null);
    }

    @Test
    public void testCallbacksKeepRegistrationOrder() {
        Callback first = args -> {};
        Callback second = args -> {};

        observable.on("pong", first);
        observable.on("pong", second);

        assertEquals(Arrays.asList(first, second), new ArrayList<>(observable.callbackMap.get("pong")));
    }

    @Test
    public void testOnceFiresOnlyOnce() {
        int[] calls = {0};
        observable.once("connected", args -> calls[0]++);
        assertEquals(1, observable.callbackMap.get("connected").size());

        observable.emitEvent("connected", "s1");
        observable.emitEvent("connected", "s2");

        assertEquals(1, calls[0]);
        assertTrue(observable.callbackMap.get("connected").isEmpty());
    }

    @Test
    public void testRemoveListener() {
        Callback kept = args -> {};
        Callback removed = args -> {};
        observable.on("server_ping", kept);
        observable.on("server_ping", removed);
        Queue<Callback> callbacks = observable.callbackMap.get("server_ping");

        observable.removeListener("server_ping", removed);
        assertTrue(callbacks.contains(kept));
        assertFalse(callbacks.contains(removed));

        observable.removeListener("no_such_event", kept);
        observable.removeAllListeners();
        assertNull(observable.callbackMap.get("server_ping"));
    }

    @Test
    public void testOnceThroughHandle() {
        int[] calls = {0, 0};
        observable.on("reconnect_attempt", args -> calls[0]++)
                  .once("reconnect_attempt", args -> calls[1]++);

        observable.emitEvent("reconnect_attempt", 1);
        observable.emitEvent("reconnect_attempt", 2);

        assertEquals(2, calls[0]);
        assertEquals(1, calls[1]);
    }

    @Test
    public void testListenerCanRemoveItselfWhileEmitting() {
        List<String> calls = new ArrayList<>();
        Callback[] self = new Callback[1];
        self[0] = args -> {
            calls.add("first");
            observable.removeListener("degraded", self[0]);
        };
        observable.on("degraded", self[0]);
        observable.on("degraded", args -> calls.add("second"));

        observable.emitEvent("degraded", 3);
        observable.emitEvent("degraded", 4);

        assertEquals(Arrays.asList("first", "second", "second"), calls);
    }

    @Test
    public void testCallbackHandleRemove() {
        Callback callback = args -> {};
        CallbackHandle handle = observable.on("ping", callback);
        assertTrue(observable.callbackMap.get("ping").contains(callback));

        handle.remove();
        assertFalse(observable.callbackMap.get("ping").contains(callback));
    }

    @Test
    public void testRegisterFromOtherThreadWhileEmitting() throws Exception {
        AtomicInteger lateCalls = new AtomicInteger();
        AtomicBoolean emitting = new AtomicBoolean(true);
        CountDownLatch firstEmit = new CountDownLatch(1);
        observable.on("pong", args -> firstEmit.countDown());

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> emitter = executor.submit(() -> {
                while(emitting.get())
                    observable.emitEvent("pong");
            });
            assertTrue(firstEmit.await(5, TimeUnit.SECONDS));

            // Registering while the emitter iterates must neither throw nor lose callbacks.
            for(int i = 0; i < 100; i++)
                observable.on("pong", args -> lateCalls.incrementAndGet());
            emitting.set(false);
            emitter.get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        assertEquals(101, observable.callbackMap.get("pong").size());
        lateCalls.set(0);
        observable.emitEvent("pong");
        assertEquals(100, lateCalls.get());
    }

    @Test
    public void testOnceFiresOnceUnderConcurrentEmits() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        observable.once("connected", args -> calls.incrementAndGet());

        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> emitters = new ArrayList<>();
            for(int i = 0; i < threads; i++)
                emitters.add(executor.submit(() -> {
                    start.await();
                    observable.emitEvent("connected");
                    return null;
                }));
            start.countDown();
            for(Future<?> emitter : emitters)
                emitter.get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, calls.get());
    }
}
