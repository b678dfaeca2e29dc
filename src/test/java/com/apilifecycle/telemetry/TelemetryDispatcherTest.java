package com.apilifecycle.telemetry;

import com.apilifecycle.engine.LifecycleDecision;
import com.apilifecycle.engine.LifecycleEvaluator;
import com.apilifecycle.engine.LifecycleHeaderFormatter;
import com.apilifecycle.policy.DeprecationPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TelemetryDispatcherTest {

    private TelemetryDispatcher dispatcher;
    private TelemetryContext context;

    @BeforeEach
    void setUp() {
        dispatcher = new TelemetryDispatcher();

        DeprecationPolicy policy = DeprecationPolicy.builder()
            .deprecationAt("2020-01-01")
            .sunsetAt("2030-01-01")
            .build();
        LifecycleDecision decision = new LifecycleEvaluator(
            Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC)).evaluate(policy);
        context = new TelemetryContext(
            new RequestDescriptor("GET", "/telemetry", 200),
            decision,
            new LifecycleHeaderFormatter().format(decision),
            policy);
    }

    @Test
    void dispatchWithoutCallback_isNoOp() {
        assertFalse(dispatcher.dispatch(context));
        assertTrue(dispatcher.registered().isEmpty());
    }

    @Test
    void registeredCallback_receivesContext() {
        List<TelemetryContext> received = new ArrayList<>();
        dispatcher.register(received::add);

        assertTrue(dispatcher.dispatch(context));

        assertEquals(1, received.size());
        assertEquals("/telemetry", received.get(0).request().path());
        assertEquals(Instant.parse("2020-01-01T00:00:00Z"), received.get(0).policy().deprecationAt());
        assertEquals("@1577836800", received.get(0).renderedHeaders().getFirst("Deprecation"));
    }

    @Test
    void lastRegistration_wins() {
        AtomicInteger first = new AtomicInteger();
        AtomicInteger second = new AtomicInteger();
        dispatcher.register(ctx -> first.incrementAndGet());
        dispatcher.register(ctx -> second.incrementAndGet());

        dispatcher.dispatch(context);

        assertEquals(0, first.get());
        assertEquals(1, second.get());
    }

    @Test
    void clear_removesCallback() {
        AtomicInteger calls = new AtomicInteger();
        dispatcher.register(ctx -> calls.incrementAndGet());
        dispatcher.clear();

        assertFalse(dispatcher.dispatch(context));
        assertEquals(0, calls.get());
    }

    @Test
    void failingCallback_isContained() {
        dispatcher.register(ctx -> {
            throw new IllegalStateException("sink down");
        });
        assertDoesNotThrow(() -> assertFalse(dispatcher.dispatch(context)));

        dispatcher.register(ctx -> {
            throw new IOException("checked failure");
        });
        assertDoesNotThrow(() -> assertFalse(dispatcher.dispatch(context)));

        dispatcher.register(ctx -> {
            throw new AssertionError("sink assertion");
        });
        assertDoesNotThrow(() -> assertFalse(dispatcher.dispatch(context)));

        dispatcher.register(ctx -> {
            throw new NoClassDefFoundError("com/example/MissingSink");
        });
        assertDoesNotThrow(() -> assertFalse(dispatcher.dispatch(context)));
    }

    @Test
    void virtualMachineError_isNotContained() {
        dispatcher.register(ctx -> {
            throw new OutOfMemoryError("heap");
        });

        assertThrows(OutOfMemoryError.class, () -> dispatcher.dispatch(context));
    }

    @Test
    void loggingCallback_handlesWarnAndBlock() {
        dispatcher.register(new LoggingTelemetryCallback());
        assertTrue(dispatcher.dispatch(context));

        DeprecationPolicy sunset = DeprecationPolicy.builder().sunsetAt("2020-01-01").build();
        LifecycleDecision blocked = new LifecycleEvaluator(Clock.systemUTC()).evaluate(sunset);
        assertTrue(dispatcher.dispatch(new TelemetryContext(
            new RequestDescriptor("GET", "/gone", 410), blocked,
            new LifecycleHeaderFormatter().format(blocked), sunset)));
    }

    @Test
    void concurrentRegisterAndDispatch_neverFails() throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        AtomicInteger delivered = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(400);
        try {
            for (int i = 0; i < 400; i++) {
                int n = i;
                pool.submit(() -> {
                    try {
                        if (n % 10 == 0) {
                            dispatcher.register(ctx -> delivered.incrementAndGet());
                        } else {
                            dispatcher.dispatch(context);
                        }
                    } finally {
                        done.countDown();
                    }
                });
            }
            assertTrue(done.await(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
        assertTrue(delivered.get() <= 360);
    }
}
