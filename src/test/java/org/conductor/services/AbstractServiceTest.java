package org.conductor.services;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.conductor.api.signals.OneShot;
import org.conductor.api.signals.ShutdownContext;
import org.conductor.api.signals.Signal;
import org.conductor.junit.extensions.logging.ExpectLog;
import org.conductor.junit.extensions.logging.LogLevel;
import org.conductor.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class AbstractServiceTest {

    private Signal ready;
    private Signal stopped;
    private OneShot<ShutdownContext> shutdown;

    @BeforeEach
    void setUp() {
        ready = new Signal();
        stopped = new Signal();
        shutdown = new OneShot<>();
    }

    @Test
    @DisplayName("Should initialize, tick until shutdown, then clean up and acknowledge")
    void run_shouldFollowFullLifecycle() throws Exception {
        // Arrange
        final TestService service = new TestService("worker", ConfigFactory.empty());

        // Act
        service.run(ready, stopped, shutdown);

        // Assert
        assertThat(ready.await(Duration.ofSeconds(2))).isTrue();
        await().atMost(Duration.ofSeconds(2)).until(() -> service.ticks.get() >= 2);
        assertThat(service.getCurrentState()).isEqualTo(AbstractService.State.RUNNING);

        final ShutdownContext context = ShutdownContext.withTimeout(Duration.ofSeconds(1));
        shutdown.offer(context);

        assertThat(stopped.await(Duration.ofSeconds(2))).isTrue();
        assertThat(service.getCurrentState()).isEqualTo(AbstractService.State.STOPPED);
        assertThat(service.calls).startsWith("initialize").endsWith("cleanup");
        assertThat(service.cleanupContext).isSameAs(context);
    }

    @Test
    @DisplayName("run returns immediately, the work happens on a thread named after the service")
    void run_shouldNotBlockCaller() throws Exception {
        final TestService service = new TestService("named-worker", ConfigFactory.empty());
        service.blockInitialize = true;

        service.run(ready, stopped, shutdown);

        assertThat(ready.isFired()).isFalse();
        await().atMost(Duration.ofSeconds(2)).until(() -> service.initializeThread != null);
        assertThat(service.initializeThread).isEqualTo("named-worker");

        service.blockInitialize = false;
        assertThat(ready.await(Duration.ofSeconds(2))).isTrue();
        shutdown.offer(ShutdownContext.withTimeout(Duration.ofSeconds(1)));
        assertThat(stopped.await(Duration.ofSeconds(2))).isTrue();
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, loggerPattern = ".*TestService", messagePattern = "broken stopped with ERROR due to IllegalStateException")
    @DisplayName("A failed initialization never signals ready but still acknowledges the shutdown request")
    void run_whenInitializeFails_shouldEnterErrorAndAcknowledgeShutdown() throws Exception {
        // Arrange
        final TestService service = new TestService("broken", ConfigFactory.empty());
        service.failInitialize = true;

        // Act
        service.run(ready, stopped, shutdown);

        // Assert
        await().atMost(Duration.ofSeconds(2)).until(() -> service.getCurrentState() == AbstractService.State.ERROR);
        assertThat(ready.isFired()).isFalse();
        assertThat(stopped.await(Duration.ofMillis(100))).isFalse();

        shutdown.offer(ShutdownContext.withTimeout(Duration.ofSeconds(1)));

        assertThat(stopped.await(Duration.ofSeconds(2))).isTrue();
        assertThat(service.calls).doesNotContain("cleanup");
    }

    @Test
    @DisplayName("A service instance can only be run once")
    void run_calledTwice_shouldThrow() throws Exception {
        final TestService service = new TestService("once", ConfigFactory.empty());
        service.run(ready, stopped, shutdown);

        assertThatThrownBy(() -> service.run(new Signal(), new Signal(), new OneShot<>()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("once");

        assertThat(ready.await(Duration.ofSeconds(2))).isTrue();
        shutdown.offer(ShutdownContext.withTimeout(Duration.ofSeconds(1)));
        assertThat(stopped.await(Duration.ofSeconds(2))).isTrue();
    }

    @Test
    @DisplayName("Null options are replaced by an empty configuration")
    void constructor_withNullOptions_shouldUseEmptyConfig() {
        final TestService service = new TestService("plain", null);

        assertThat(service.options.isEmpty()).isTrue();
        assertThat(service.getServiceName()).isEqualTo("plain");
        assertThat(service.getCurrentState()).isEqualTo(AbstractService.State.NEW);
    }

    private static final class TestService extends AbstractService {
        private final List<String> calls = new CopyOnWriteArrayList<>();
        private final AtomicInteger ticks = new AtomicInteger();
        private volatile boolean failInitialize;
        private volatile boolean blockInitialize;
        private volatile String initializeThread;
        private volatile ShutdownContext cleanupContext;

        TestService(final String name, final Config options) {
            super(name, options);
        }

        @Override
        protected void initialize() throws Exception {
            calls.add("initialize");
            initializeThread = Thread.currentThread().getName();
            while (blockInitialize) {
                Thread.sleep(5);
            }
            if (failInitialize) {
                throw new IllegalStateException("resource unavailable");
            }
        }

        @Override
        protected void tick() {
            calls.add("tick");
            ticks.incrementAndGet();
        }

        @Override
        protected void cleanup(final ShutdownContext context) {
            calls.add("cleanup");
            cleanupContext = context;
        }

        @Override
        protected Duration getTickInterval() {
            return Duration.ofMillis(10);
        }
    }
}
