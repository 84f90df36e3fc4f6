package com.forecastops.orchestrator.service;

import com.forecastops.orchestrator.model.Execution;
import com.forecastops.orchestrator.task.ErrorKind;
import com.forecastops.orchestrator.workflow.ExecutionRunner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ExecutionSchedulerTest {

    @Mock ExecutionService executionService;
    @Mock ExecutionRunner  runner;

    ExecutionScheduler scheduler;
    CountDownLatch     release = new CountDownLatch(1);

    @AfterEach
    void tearDown() {
        release.countDown();
        scheduler.shutdown();
    }

    @Test
    void tick_allWorkersBusy_doesNotClaim() throws Exception {
        scheduler = new ExecutionScheduler(executionService, runner, 1);
        Execution execution = mock(Execution.class);
        CountDownLatch running = new CountDownLatch(1);
        when(executionService.claimNext(anyString())).thenReturn(Optional.of(execution));
        doAnswer(inv -> {
            running.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
        }).when(runner).run(execution);

        scheduler.tick();
        running.await(5, TimeUnit.SECONDS);
        scheduler.tick();

        verify(executionService, times(1)).claimNext(anyString());
    }

    @Test
    void tick_nothingDue_keepsWorkerFree() {
        scheduler = new ExecutionScheduler(executionService, runner, 1);
        when(executionService.claimNext(anyString())).thenReturn(Optional.empty());

        scheduler.tick();
        scheduler.tick();

        verify(executionService, times(2)).claimNext(anyString());
        verifyNoInteractions(runner);
    }

    @Test
    void tick_runnerThrows_abortsUnderSameWorker() {
        scheduler = new ExecutionScheduler(executionService, runner, 1);
        Execution execution = mock(Execution.class);
        UUID id = UUID.randomUUID();
        when(execution.getId()).thenReturn(id);
        when(executionService.claimNext(anyString())).thenReturn(Optional.of(execution));
        doThrow(new IllegalStateException("boom")).when(runner).run(execution);

        scheduler.tick();

        verify(executionService, timeout(5000)).abort(eq(id), startsWith("worker-"), eq(ErrorKind.INTERNAL), any());
    }
}
