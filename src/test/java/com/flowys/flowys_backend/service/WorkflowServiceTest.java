package com.flowys.flowys_backend.service;

import com.flowys.flowys_backend.engine.ExecutionEventPublisher;
import com.flowys.flowys_backend.engine.ExecutionListener;
import com.flowys.flowys_backend.engine.WorkflowExecutor;
import com.flowys.flowys_backend.model.domain.NodeType;
import com.flowys.flowys_backend.model.domain.WorkflowNode;
import com.flowys.flowys_backend.model.dto.ExecuteWorkflowRequest;
import com.flowys.flowys_backend.model.dto.WorkflowRunResponse;
import com.flowys.flowys_backend.model.execution.WorkflowExecutionResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class WorkflowServiceTest {

    private WorkflowExecutor executor;
    private CreditLedger ledger;
    private ExecutionEventPublisher events;
    private ExecutorService pool;
    private WorkflowService service;

    private final ExecuteWorkflowRequest request = new ExecuteWorkflowRequest("wf-1",
            List.of(WorkflowNode.builder().id("a").type(NodeType.AI).build(),
                    WorkflowNode.builder().id("b").type(NodeType.API).build()),
            List.of(), Map.of("topic", "lamps"));

    @BeforeEach
    void setUp() {
        executor = mock(WorkflowExecutor.class);
        ledger = mock(CreditLedger.class);
        events = mock(ExecutionEventPublisher.class);
        pool = Executors.newSingleThreadExecutor();
        service = new WorkflowService(executor, ledger, events, pool);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private void allowRun() {
        when(ledger.hasEnoughCredits(eq("ada"), anyList())).thenReturn(new CreditLedger.CreditCheck(true, 11, 100));
        when(ledger.deductCredits("ada", 11)).thenReturn(new CreditLedger.CreditDeduction(true, 89, null));
    }

    private static WorkflowExecutionResult result(boolean success) {
        return WorkflowExecutionResult.builder()
                .success(success)
                .output(success ? Map.of("ok", true) : null)
                .error(success ? null : "Node \"A\" failed: boom")
                .logs(List.of())
                .executionOrder(List.of("a", "b"))
                .duration(5)
                .build();
    }

    @Nested
    class SyncRuns {

        @Test
        void shouldChargeAfterSuccessfulRun() {
            allowRun();
            when(executor.execute(anyList(), anyList(), anyMap(), any(ExecutionListener.class))).thenReturn(result(true));

            WorkflowRunResponse response = service.execute("ada", request);

            assertThat(response.status()).isEqualTo("completed");
            assertThat(response.workflowId()).isEqualTo("wf-1");
            assertThat(response.output()).isEqualTo(Map.of("ok", true));
            assertThat(response.credits().used()).isEqualTo(11);
            assertThat(response.credits().remaining()).isEqualTo(89);
            verify(events).workflowStarted(eq(response.id()), anyMap());
            verify(events).workflowFinished(eq(response.id()), eq(true), anyMap());
        }

        @Test
        void shouldStillChargeWhenTheRunFails() {
            allowRun();
            when(executor.execute(anyList(), anyList(), anyMap(), any(ExecutionListener.class))).thenReturn(result(false));

            WorkflowRunResponse response = service.execute("ada", request);

            assertThat(response.status()).isEqualTo("failed");
            assertThat(response.error()).isEqualTo("Node \"A\" failed: boom");
            verify(ledger).deductCredits("ada", 11);
            verify(events).workflowFinished(eq(response.id()), eq(false), anyMap());
        }

        @Test
        void shouldRefuseBeforeRunningWhenCreditsAreShort() {
            when(ledger.hasEnoughCredits(eq("ada"), anyList())).thenReturn(new CreditLedger.CreditCheck(false, 11, 3));

            assertThatThrownBy(() -> service.execute("ada", request))
                    .isInstanceOf(InsufficientCreditsException.class)
                    .hasMessage("This workflow requires 11 credits, but you only have 3 remaining.");

            verifyNoInteractions(executor, events);
            verify(ledger, never()).deductCredits(anyString(), org.mockito.ArgumentMatchers.anyLong());
        }
    }

    @Nested
    class AsyncRuns {

        @Test
        void shouldRunOnThePoolAndForgetFinishedRuns() {
            allowRun();
            when(executor.execute(anyList(), anyList(), anyMap(), any(ExecutionListener.class))).thenReturn(result(true));

            String id = service.executeAsync("ada", request);

            verify(events, timeout(2000)).workflowFinished(eq(id), eq(true), anyMap());
            verify(ledger, timeout(2000)).deductCredits("ada", 11);
        }

        @Test
        void shouldCancelRunningExecution() throws InterruptedException {
            allowRun();
            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch interrupted = new CountDownLatch(1);
            when(executor.execute(anyList(), anyList(), anyMap(), any(ExecutionListener.class))).thenAnswer(inv -> {
                started.countDown();
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    Thread.currentThread().interrupt();
                }
                return result(false);
            });

            String id = service.executeAsync("ada", request);
            assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();
            assertThat(service.runningExecutions()).containsExactly(id);

            assertThat(service.cancel(id)).isTrue();

            assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
            assertThat(service.runningExecutions()).isEmpty();
            assertThat(service.cancel(id)).isFalse();
        }

        @Test
        void shouldPublishCancellationForQueuedRunThatNeverStarted() throws InterruptedException {
            allowRun();
            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            when(executor.execute(anyList(), anyList(), anyMap(), any(ExecutionListener.class))).thenAnswer(inv -> {
                started.countDown();
                release.await(5, TimeUnit.SECONDS);
                return result(true);
            });

            String first = service.executeAsync("ada", request);
            assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();
            String queued = service.executeAsync("ada", request);

            assertThat(service.cancel(queued)).isTrue();
            verify(events).workflowFinished(queued, false, Map.of("status", "failed", "error", "Execution cancelled"));

            release.countDown();
            verify(events, timeout(2000)).workflowFinished(eq(first), eq(true), anyMap());
            pool.shutdown();
            assertThat(pool.awaitTermination(2, TimeUnit.SECONDS)).isTrue();
            verify(events, never()).workflowStarted(eq(queued), anyMap());
            verify(executor, times(1)).execute(anyList(), anyList(), anyMap(), any(ExecutionListener.class));
            assertThat(service.runningExecutions()).isEmpty();
        }

        @Test
        void shouldReportUnknownExecutionAsNotCancelled() {
            assertThat(service.cancel("missing")).isFalse();
        }

        @Test
        void shouldPublishFailureWhenTheRunCrashes() {
            allowRun();
            when(executor.execute(anyList(), anyList(), anyMap(), any(ExecutionListener.class)))
                    .thenThrow(new IllegalStateException("engine down"));

            String id = service.executeAsync("ada", request);

            verify(events, timeout(2000)).workflowFinished(id, false, Map.of("status", "failed", "error", "engine down"));
        }
    }

    @Test
    void shouldEstimateCostPerType() {
        WorkflowService.CostEstimate estimate = service.estimate(request.nodes());

        assertThat(estimate.total()).isEqualTo(11);
        assertThat(estimate.byType()).containsEntry(NodeType.AI, 10L).containsEntry(NodeType.API, 1L);
    }
}
