package tech.noetzold.gateway_api.validation;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Terminal state of one dispatched engine call. Starts {@link Decision#PENDING}; the first
 * {@link #settle} wins and every later attempt (late error after success, timeout after
 * reply, ...) is rejected. The settle callback, i.e. the audit record, runs exactly once,
 * on the winning transition, whether or not anyone is still waiting for the result.
 */
@Slf4j
public class ValidationSettlement {

    private final String requestId;
    private final Consumer<ValidationOutcome> onSettled;
    private final AtomicReference<Decision> state = new AtomicReference<>(Decision.PENDING);
    private final CompletableFuture<ValidationOutcome> result = new CompletableFuture<>();

    public ValidationSettlement(String requestId, Consumer<ValidationOutcome> onSettled) {
        this.requestId = requestId;
        this.onSettled = Objects.requireNonNull(onSettled, "onSettled");
    }

    /**
     * Moves PENDING to the outcome's decision.
     *
     * @return {@code false} when the call was already settled; the outcome is then discarded
     */
    public boolean settle(ValidationOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome");
        if (!state.compareAndSet(Decision.PENDING, outcome.decision())) {
            log.debug("Request {} already settled as {}, ignoring {}", requestId, state.get(), outcome.decision());
            return false;
        }
        try {
            onSettled.accept(outcome);
        } catch (RuntimeException e) {
            log.error("Settlement callback failed for request {}: {}", requestId, e.getMessage(), e);
        }
        result.complete(outcome);
        return true;
    }

    /**
     * Waits for the terminal outcome. If none arrives within {@code timeout}, settles with
     * {@code onFailure} applied to a {@link TimeoutException}; a reply arriving afterwards is ignored.
     */
    public ValidationOutcome await(Duration timeout, Function<Throwable, ValidationOutcome> onFailure) {
        try {
            return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            settle(onFailure.apply(new TimeoutException("no engine reply within " + timeout.toMillis() + "ms")));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            settle(onFailure.apply(e));
        } catch (ExecutionException e) {
            throw new IllegalStateException("settlement future completed exceptionally", e.getCause());
        }
        return result.join();
    }

    public Decision state() {
        return state.get();
    }
}
