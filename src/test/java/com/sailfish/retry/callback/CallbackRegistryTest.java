package com.sailfish.retry.callback;

import com.sailfish.retry.policy.ExecutionMode;
import com.sailfish.retry.policy.RetryConfigurationException;
import org.junit.jupiter.api.Test;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static com.sailfish.retry.callback.CallbackOption.BREAK_OUT;
import static com.sailfish.retry.callback.CallbackOption.RUN_ON_LAST_ATTEMPT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CallbackRegistryTest {

    private final FailureCallback ioCallback = failure -> { };
    private final FailureCallback fileCallback = failure -> { };
    private final FailureCallback stateCallback = failure -> { };

    @Test
    void none_shouldSelectNothing() {
        assertThat(CallbackRegistry.none().select(new IOException(), false)).isEmpty();
        assertThat(CallbackRegistry.none().getMode()).isEqualTo(ExecutionMode.BLOCKING);
        assertThat(CallbackRegistry.noneAsync().getMode()).isEqualTo(ExecutionMode.SUSPENDING);
    }

    @Test
    void of_shouldKeySingleCallbackToAnyException() {
        CallbackRegistry<FailureCallback> registry = CallbackRegistry.of(ioCallback, BREAK_OUT);

        assertThat(registry.getEntries()).hasSize(1);
        CallbackEntry<FailureCallback> entry = registry.getEntries().get(0);
        assertThat(entry.getFailureType()).isEqualTo(Exception.class);
        assertThat(entry.getOptions()).containsExactly(BREAK_OUT);
        assertThat(registry.select(new IllegalStateException(), false)).containsExactly(entry);
    }

    @Test
    void ofAsync_shouldBuildSuspendingRegistry() {
        CallbackRegistry<AsyncFailureCallback> registry =
                CallbackRegistry.ofAsync(failure -> CompletableFuture.completedFuture(null));

        assertThat(registry.getMode()).isEqualTo(ExecutionMode.SUSPENDING);
        assertThat(registry.getEntries()).hasSize(1);
    }

    @Test
    void select_shouldFollowRegistrationOrder_notSpecificity() {
        // Given
        CallbackRegistry<FailureCallback> registry = CallbackRegistry.builder()
                .on(IOException.class, ioCallback)
                .on(FileNotFoundException.class, fileCallback)
                .on(IllegalStateException.class, stateCallback)
                .build();

        // When
        List<CallbackEntry<FailureCallback>> selected = registry.select(new FileNotFoundException("gone"), false);

        // Then
        assertThat(selected).extracting(CallbackEntry::getCallback).containsExactly(ioCallback, fileCallback);
    }

    @Test
    void select_shouldStopAfterBreakOutEntry() {
        CallbackRegistry<FailureCallback> registry = CallbackRegistry.builder()
                .on(IOException.class, ioCallback, BREAK_OUT)
                .on(FileNotFoundException.class, fileCallback)
                .build();

        assertThat(registry.select(new FileNotFoundException(), false))
                .extracting(CallbackEntry::getCallback)
                .containsExactly(ioCallback);
    }

    @Test
    void select_shouldReachSubtypeEntry_whenRegisteredBeforeBreakOutSupertype() {
        CallbackRegistry<FailureCallback> registry = CallbackRegistry.builder()
                .on(FileNotFoundException.class, fileCallback)
                .on(IOException.class, ioCallback, BREAK_OUT)
                .on(Exception.class, stateCallback)
                .build();

        assertThat(registry.select(new FileNotFoundException(), false))
                .extracting(CallbackEntry::getCallback)
                .containsExactly(fileCallback, ioCallback);
    }

    @Test
    void select_shouldSkipEntriesWithoutRunOnLastAttempt_onLastAttempt() {
        CallbackRegistry<FailureCallback> registry = CallbackRegistry.builder()
                .on(IOException.class, ioCallback)
                .on(Exception.class, stateCallback, RUN_ON_LAST_ATTEMPT)
                .build();

        assertThat(registry.select(new IOException(), true))
                .extracting(CallbackEntry::getCallback)
                .containsExactly(stateCallback);
        assertThat(registry.select(new IOException(), false))
                .extracting(CallbackEntry::getCallback)
                .containsExactly(ioCallback, stateCallback);
    }

    @Test
    void select_shouldNotBreakOnSkippedEntry() {
        // BREAK_OUT on an entry skipped for the last attempt does not stop the scan
        CallbackRegistry<FailureCallback> registry = CallbackRegistry.builder()
                .on(IOException.class, ioCallback, BREAK_OUT)
                .on(Exception.class, stateCallback, RUN_ON_LAST_ATTEMPT)
                .build();

        assertThat(registry.select(new IOException(), true))
                .extracting(CallbackEntry::getCallback)
                .containsExactly(stateCallback);
    }

    @Test
    void select_shouldReturnEmpty_whenNoEntryMatches() {
        CallbackRegistry<FailureCallback> registry = CallbackRegistry.builder()
                .on(IOException.class, ioCallback)
                .build();

        assertThat(registry.select(new IllegalArgumentException(), false)).isEmpty();
    }

    @Test
    void on_shouldRejectDuplicateType() {
        CallbackRegistry.Builder<FailureCallback> builder = CallbackRegistry.builder().on(IOException.class, ioCallback);

        assertThatThrownBy(() -> builder.on(IOException.class, fileCallback))
                .isInstanceOf(RetryConfigurationException.class)
                .hasMessageContaining("already registered");
    }

    @Test
    void entries_shouldBeImmutable() {
        CallbackRegistry<FailureCallback> registry = CallbackRegistry.of(ioCallback);

        assertThatThrownBy(() -> registry.getEntries().clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> registry.getEntries().get(0).getOptions().add(BREAK_OUT))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
