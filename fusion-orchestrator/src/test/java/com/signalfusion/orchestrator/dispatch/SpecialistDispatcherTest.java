package com.signalfusion.orchestrator.dispatch;

import com.signalfusion.common.model.SpecialistKind;
import com.signalfusion.common.model.SpecialistResult;
import com.signalfusion.orchestrator.specialist.Specialist;
import com.signalfusion.orchestrator.specialist.SpecialistContext;
import com.signalfusion.orchestrator.specialist.SpecialistOutcome;
import com.signalfusion.orchestrator.specialist.SpecialistOutcome.Status;
import com.signalfusion.orchestrator.specialist.SpecialistRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;

import static org.junit.jupiter.api.Assertions.*;

class SpecialistDispatcherTest {

    private static final SpecialistContext CTX = SpecialistContext.of("AAPL", null);

    /** Specialist whose behaviour is chosen per attempt number (1-based). */
    static final class ScriptedSpecialist implements Specialist {
        private final SpecialistKind kind;
        private final IntFunction<Mono<SpecialistResult>> script;
        private final AtomicInteger attempts = new AtomicInteger();

        ScriptedSpecialist(SpecialistKind kind, IntFunction<Mono<SpecialistResult>> script) {
            this.kind = kind;
            this.script = script;
        }

        @Override public SpecialistKind kind() { return kind; }

        @Override
        public Mono<SpecialistResult> analyze(SpecialistContext context) {
            return script.apply(attempts.incrementAndGet());
        }
    }

    private static SpecialistResult buy(SpecialistKind kind) {
        return SpecialistResult.of(kind, "AAPL", Map.of("signal", "BUY"), 0.8);
    }

    private static SpecialistDispatcher dispatcher(Specialist... specialists) {
        return new SpecialistDispatcher(new SpecialistRegistry(List.of(specialists)),
                                        Duration.ofSeconds(60), 3,
                                        Duration.ofMillis(500), Duration.ofSeconds(5));
    }

    // ── success path ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("success")
    class SuccessTests {

        @Test
        @DisplayName("outcomes come back in request order")
        void ordered() {
            SpecialistDispatcher d = dispatcher(
                new ScriptedSpecialist(SpecialistKind.TECHNICAL, n -> Mono.just(buy(SpecialistKind.TECHNICAL))),
                new ScriptedSpecialist(SpecialistKind.FUNDAMENTAL, n -> Mono.just(buy(SpecialistKind.FUNDAMENTAL))));

            StepVerifier.create(d.dispatch(CTX, List.of(SpecialistKind.FUNDAMENTAL, SpecialistKind.TECHNICAL)))
                .assertNext(outcomes -> {
                    assertEquals(List.of(SpecialistKind.FUNDAMENTAL, SpecialistKind.TECHNICAL),
                                 outcomes.stream().map(SpecialistOutcome::kind).toList());
                    assertTrue(outcomes.stream().allMatch(SpecialistOutcome::isSuccess));
                    assertEquals(1, outcomes.get(0).attempts());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("specialists run concurrently: two 10s calls finish within 10s")
        void parallel() {
            StepVerifier.withVirtualTime(() -> dispatcher(
                    new ScriptedSpecialist(SpecialistKind.TECHNICAL,
                        n -> Mono.delay(Duration.ofSeconds(10)).thenReturn(buy(SpecialistKind.TECHNICAL))),
                    new ScriptedSpecialist(SpecialistKind.FUNDAMENTAL,
                        n -> Mono.delay(Duration.ofSeconds(10)).thenReturn(buy(SpecialistKind.FUNDAMENTAL))))
                    .dispatch(CTX, List.of(SpecialistKind.TECHNICAL, SpecialistKind.FUNDAMENTAL)))
                .expectSubscription()
                .thenAwait(Duration.ofSeconds(10))
                .assertNext(outcomes -> assertTrue(outcomes.stream().allMatch(SpecialistOutcome::isSuccess)))
                .expectComplete()
                .verify(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("two failures then success → SUCCESS after 3 attempts")
        void retriedToSuccess() {
            ScriptedSpecialist flaky = new ScriptedSpecialist(SpecialistKind.NEWS, n -> n < 3
                ? Mono.error(new IllegalStateException("HTTP 503"))
                : Mono.just(buy(SpecialistKind.NEWS)));

            StepVerifier.withVirtualTime(() -> dispatcher(flaky).dispatch(CTX, List.of(SpecialistKind.NEWS)))
                .expectSubscription()
                .thenAwait(Duration.ofMinutes(1))
                .assertNext(outcomes -> {
                    assertEquals(Status.SUCCESS, outcomes.get(0).status());
                    assertEquals(3, outcomes.get(0).attempts());
                })
                .expectComplete()
                .verify(Duration.ofSeconds(5));
        }
    }

    // ── degraded path ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("absent and failed")
    class DegradedTests {

        @Test
        @DisplayName("never responds → ABSENT after 1 + 3 timed-out attempts, not an error")
        void timeoutIsAbsent() {
            SpecialistDispatcher d = dispatcher(
                new ScriptedSpecialist(SpecialistKind.MACRO, n -> Mono.never()),
                new ScriptedSpecialist(SpecialistKind.TECHNICAL, n -> Mono.just(buy(SpecialistKind.TECHNICAL))));

            StepVerifier.withVirtualTime(() -> d.dispatch(CTX, List.of(SpecialistKind.MACRO, SpecialistKind.TECHNICAL)))
                .expectSubscription()
                .thenAwait(Duration.ofMinutes(10))
                .assertNext(outcomes -> {
                    SpecialistOutcome macro = outcomes.get(0);
                    assertEquals(Status.ABSENT, macro.status());
                    assertEquals(4, macro.attempts());
                    assertTrue(macro.error().isTimeout());
                    assertEquals(SpecialistKind.MACRO, macro.error().getKind());
                    assertTrue(outcomes.get(1).isSuccess());
                })
                .expectComplete()
                .verify(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("always raises → FAILED with the last error")
        void errorIsFailed() {
            ScriptedSpecialist broken = new ScriptedSpecialist(SpecialistKind.RISK,
                n -> Mono.error(new IllegalStateException("boom " + n)));

            StepVerifier.withVirtualTime(() -> dispatcher(broken).dispatch(CTX, List.of(SpecialistKind.RISK)))
                .expectSubscription()
                .thenAwait(Duration.ofMinutes(1))
                .assertNext(outcomes -> {
                    SpecialistOutcome risk = outcomes.get(0);
                    assertEquals(Status.FAILED, risk.status());
                    assertEquals(4, risk.attempts());
                    assertFalse(risk.error().isTimeout());
                    assertTrue(risk.error().getMessage().contains("boom 4"));
                })
                .expectComplete()
                .verify(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("empty response is treated as a failure")
        void emptyIsFailed() {
            ScriptedSpecialist silent = new ScriptedSpecialist(SpecialistKind.SENTIMENT, n -> Mono.empty());

            StepVerifier.withVirtualTime(() -> dispatcher(silent).dispatch(CTX, List.of(SpecialistKind.SENTIMENT)))
                .expectSubscription()
                .thenAwait(Duration.ofMinutes(1))
                .assertNext(outcomes -> assertEquals(Status.FAILED, outcomes.get(0).status()))
                .expectComplete()
                .verify(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("unregistered kind → ABSENT with zero attempts")
        void unregistered() {
            StepVerifier.create(dispatcher().dispatch(CTX, List.of(SpecialistKind.NEWS)))
                .assertNext(outcomes -> {
                    assertEquals(Status.ABSENT, outcomes.get(0).status());
                    assertEquals(0, outcomes.get(0).attempts());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("result for the wrong kind → FAILED")
        void wrongKind() {
            ScriptedSpecialist confused = new ScriptedSpecialist(SpecialistKind.TECHNICAL,
                n -> Mono.just(buy(SpecialistKind.MACRO)));

            StepVerifier.create(dispatcher(confused).dispatch(CTX, List.of(SpecialistKind.TECHNICAL)))
                .assertNext(outcomes -> assertEquals(Status.FAILED, outcomes.get(0).status()))
                .verifyComplete();
        }
    }
}
