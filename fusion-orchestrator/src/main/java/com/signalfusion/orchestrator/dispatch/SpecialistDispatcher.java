package com.signalfusion.orchestrator.dispatch;

import com.signalfusion.common.exception.SpecialistException;
import com.signalfusion.common.model.SpecialistKind;
import com.signalfusion.common.model.SpecialistResult;
import com.signalfusion.orchestrator.specialist.Specialist;
import com.signalfusion.orchestrator.specialist.SpecialistContext;
import com.signalfusion.orchestrator.specialist.SpecialistOutcome;
import com.signalfusion.orchestrator.specialist.SpecialistRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans one symbol out to the requested specialists in parallel.
 *
 * <p>Each call is an independent unit of work:
 * <pre>
 *   analyze(ctx) → timeout(per attempt) → retry(maxRetries, exponential backoff) → SpecialistOutcome
 * </pre>
 * Every error is folded into an outcome value, so the returned {@code Mono} never errors and
 * completes once every call has succeeded, timed out or failed. Outcomes come back in the
 * order of {@code kinds}.
 */
public class SpecialistDispatcher {

    private static final Logger log = LoggerFactory.getLogger(SpecialistDispatcher.class);

    private final SpecialistRegistry registry;
    private final Duration timeout;
    private final int maxRetries;
    private final Duration initialBackoff;
    private final Duration maxBackoff;

    public SpecialistDispatcher(SpecialistRegistry registry, Duration timeout, int maxRetries,
                                Duration initialBackoff, Duration maxBackoff) {
        this.registry       = registry;
        this.timeout        = timeout;
        this.maxRetries     = maxRetries;
        this.initialBackoff = initialBackoff;
        this.maxBackoff     = maxBackoff;
    }

    public Mono<List<SpecialistOutcome>> dispatch(SpecialistContext context, Collection<SpecialistKind> kinds) {
        log.info("SPECIALISTS_DISPATCHED symbol={} kinds={} timeoutMs={} maxRetries={}",
                 context.symbol(), kinds, timeout.toMillis(), maxRetries);
        return Flux.fromIterable(kinds)
            .flatMapSequential(kind -> callOne(kind, context))
            .collectList();
    }

    private Mono<SpecialistOutcome> callOne(SpecialistKind kind, SpecialistContext context) {
        Optional<Specialist> specialist = registry.find(kind);
        if (specialist.isEmpty()) {
            log.warn("SPECIALIST_ABSENT kind={} symbol={} reason=not-registered", kind, context.symbol());
            return Mono.just(SpecialistOutcome.absent(kind,
                new SpecialistException(kind, context.symbol(), "no specialist registered"), 0));
        }

        AtomicInteger attempts = new AtomicInteger();
        return Mono.defer(() -> {
                attempts.incrementAndGet();
                return specialist.get().analyze(context);
            })
            .switchIfEmpty(Mono.error(() -> new SpecialistException(kind, context.symbol(), "empty response")))
            .timeout(timeout)
            .retryWhen(Retry.backoff(maxRetries, initialBackoff)
                .maxBackoff(maxBackoff)
                .doBeforeRetry(signal -> log.info("SPECIALIST_RETRY kind={} symbol={} attempt={} reason={}",
                                                  kind, context.symbol(), signal.totalRetries() + 1,
                                                  signal.failure().toString()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
            .map(result -> toSuccess(kind, context.symbol(), result, attempts.get()))
            .onErrorResume(e -> Mono.just(toFailure(kind, context.symbol(), e, attempts.get())));
    }

    private SpecialistOutcome toSuccess(SpecialistKind kind, String symbol, SpecialistResult result, int attempts) {
        if (result.kind() != kind) {
            throw new SpecialistException(kind, symbol, "returned a result for " + result.kind());
        }
        log.info("SPECIALIST_SUCCEEDED kind={} symbol={} confidence={} attempts={}",
                 kind, symbol, result.confidence(), attempts);
        return SpecialistOutcome.success(result, attempts);
    }

    private SpecialistOutcome toFailure(SpecialistKind kind, String symbol, Throwable e, int attempts) {
        boolean timedOut = e instanceof TimeoutException;
        SpecialistException error = e instanceof SpecialistException se
            ? se
            : new SpecialistException(kind, symbol, timedOut ? "timed out after " + timeout.toMillis() + "ms"
                                                             : String.valueOf(e.getMessage()), e, timedOut);
        if (timedOut || error.isTimeout()) {
            log.warn("SPECIALIST_ABSENT kind={} symbol={} attempts={} reason=timeout", kind, symbol, attempts);
            return SpecialistOutcome.absent(kind, error, attempts);
        }
        log.warn("SPECIALIST_FAILED kind={} symbol={} attempts={} reason={}", kind, symbol, attempts, error.getMessage());
        return SpecialistOutcome.failed(kind, error, attempts);
    }
}
