package com.stator.internal;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StatorSignalHandlerTest {

    private static final Duration GRACE = Duration.ofSeconds(30);

    private final StatorRunner runner = mock(StatorRunner.class);
    private final AtomicInteger exitCode = new AtomicInteger(-1);
    private final AtomicInteger haltCode = new AtomicInteger(-1);
    private final StatorSignalHandler handler =
            new StatorSignalHandler(runner, GRACE, exitCode::set, haltCode::set);

    @Test
    void shouldExitCleanlyAfterDrainOnFirstSignal() {
        when(runner.drain(GRACE)).thenReturn(true);

        handler.onSignal("TERM");

        await().atMost(Duration.ofSeconds(5)).until(() -> exitCode.get() == 0);
        verify(runner, never()).forceStop();
        assertThat(haltCode).hasValue(-1);
    }

    @Test
    void shouldExitWithFailureWhenGracePeriodExpires() {
        when(runner.drain(GRACE)).thenReturn(false);

        handler.onSignal("INT");

        await().atMost(Duration.ofSeconds(5)).until(() -> exitCode.get() == 1);
    }

    @Test
    void shouldHaltImmediatelyOnSecondSignal() {
        when(runner.drain(GRACE)).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return true;
        });

        handler.onSignal("INT");
        handler.onSignal("INT");

        verify(runner).forceStop();
        assertThat(haltCode).hasValue(130);
    }
}
