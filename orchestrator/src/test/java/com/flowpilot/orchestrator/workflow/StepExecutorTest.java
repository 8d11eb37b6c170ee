package com.flowpilot.orchestrator.workflow;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class StepExecutorTest {

    StepExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new StepExecutor(2);
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    @Test
    void execute_success_capturesOutputAndElapsed() {
        StepResult result = executor.execute(new Step("ok", StepAction.constant(42)), new Context());

        assertThat(result.succeeded()).isTrue();
        assertThat(result.output()).isEqualTo(42);
        assertThat(result.elapsed()).isGreaterThanOrEqualTo(Duration.ZERO);
    }

    @Test
    void execute_actionThrows_returnsFailureInsteadOfThrowing() {
        StepResult result = executor.execute(
                new Step("bad", ctx -> { throw new IllegalArgumentException("nope"); }), new Context());

        assertThat(result.succeeded()).isFalse();
        assertThat(result.failure()).isInstanceOf(IllegalArgumentException.class).hasMessage("nope");
    }

    @Test
    void execute_timedStepThrows_unwrapsOriginalException() {
        StepResult result = executor.execute(
                new Step("bad", ctx -> { throw new IllegalStateException("inner"); }, Duration.ofSeconds(1)),
                new Context());

        assertThat(result.failure()).isInstanceOf(IllegalStateException.class).hasMessage("inner");
    }

    @Test
    void execute_timeout_interruptsTheAction() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        Step slow = new Step("slow", ctx -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return null;
        }, Duration.ofMillis(50));

        StepResult result = executor.execute(slow, new Context());

        assertThat(result.timedOut()).isTrue();
        assertThat(((StepTimeoutException) result.failure()).getStepName()).isEqualTo("slow");
        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void execute_stepIgnoringInterrupt_doesNotStarveLaterTimedSteps() {
        StepExecutor single = new StepExecutor(1);
        try {
            Step stuck = new Step("stuck", ctx -> {
                long until = System.nanoTime() + Duration.ofSeconds(2).toNanos();
                while (System.nanoTime() < until) {
                    Thread.onSpinWait();
                }
                return "late";
            }, Duration.ofMillis(100));
            Step quick = new Step("quick", StepAction.constant("ok"), Duration.ofMillis(500));

            StepResult first = single.execute(stuck, new Context());
            StepResult second = single.execute(quick, new Context());

            assertThat(first.timedOut()).isTrue();
            assertThat(second.succeeded()).isTrue();
            assertThat(second.output()).isEqualTo("ok");
        } finally {
            single.close();
        }
    }
}
