package org.conductor.core;

import org.conductor.junit.extensions.logging.LogWatchExtension;
import org.conductor.testutils.RecordingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the termination hook that bridges JVM shutdown to {@link Conductor#stop()}.
 */
@Tag("unit")
@ExtendWith({MockitoExtension.class, LogWatchExtension.class})
class SignalBridgeTest {

    @Mock
    private IShutdownHookRegistry registry;

    private List<String> journal;

    @BeforeEach
    void setUp() {
        journal = RecordingService.newJournal();
    }

    @Test
    @DisplayName("No hook is installed unless signal hooking is enabled")
    void constructor_withoutHookSignals_shouldNotInstallHook() {
        final Conductor conductor = new Conductor(ConductorOptions.defaults(), registry);

        assertThat(conductor.getSignalBridge()).isEmpty();
        verify(registry, never()).addShutdownHook(any());
    }

    @Test
    @DisplayName("Running the hook stops every service and fires completion")
    void hook_shouldStopConductor() throws Exception {
        // Arrange
        final ArgumentCaptor<Thread> hookCaptor = ArgumentCaptor.forClass(Thread.class);
        final Conductor conductor = new Conductor(ConductorOptions.builder().hookSignals(true).build(), registry);
        final RecordingService service = RecordingService.ready("api", journal);
        conductor.service("api", service);
        conductor.start();
        verify(registry).addShutdownHook(hookCaptor.capture());

        // Act - simulate the JVM running the hook on SIGTERM
        final Thread hook = hookCaptor.getValue();
        hook.start();
        hook.join(5000);

        // Assert
        assertThat(hook.isAlive()).isFalse();
        assertThat(service.receivedShutdownRequest()).isTrue();
        assertThat(conductor.getCompletionSignal().isFired()).isTrue();
        verify(registry).removeShutdownHook(hook);
    }

    @Test
    @DisplayName("Triggering twice only stops the conductor once")
    void trigger_calledTwice_shouldStopOnce() {
        final Conductor conductor = new Conductor(ConductorOptions.builder().hookSignals(true).build(), registry);
        conductor.service("api", RecordingService.ready("api", journal));
        conductor.start();
        final SignalBridge bridge = conductor.getSignalBridge().orElseThrow();

        assertThat(bridge.trigger("SIGINT")).isTrue();
        assertThat(bridge.trigger("SIGINT")).isFalse();
        assertThat(journal).containsOnlyOnce("shutdown:api");
    }

    @Test
    @DisplayName("A conductor that already stopped removes its hook and ignores later signals")
    void trigger_afterCompletion_shouldBeNoOp() {
        // Arrange
        final Conductor conductor = new Conductor(ConductorOptions.builder().hookSignals(true).build(), registry);
        final SignalBridge bridge = conductor.getSignalBridge().orElseThrow();
        conductor.start();

        // Act
        conductor.stop();

        // Assert
        verify(registry).removeShutdownHook(bridge.getHook());
        assertThat(bridge.trigger("SIGTERM")).isFalse();
    }

    @Test
    @DisplayName("A JVM that is already shutting down does not break hook removal")
    void uninstall_duringJvmShutdown_shouldBeTolerated() {
        // Arrange
        when(registry.removeShutdownHook(any())).thenThrow(new IllegalStateException("Shutdown in progress"));
        final Conductor conductor = new Conductor(ConductorOptions.builder().hookSignals(true).build(), registry);
        conductor.start();

        // Act
        conductor.stop();

        // Assert
        assertThat(conductor.getCompletionSignal().isFired()).isTrue();
    }
}
