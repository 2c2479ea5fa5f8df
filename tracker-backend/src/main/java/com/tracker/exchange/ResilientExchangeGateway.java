package com.tracker.exchange;

import com.tracker.core.exchange.ExchangeGateway;
import com.tracker.core.exchange.FetchException;
import com.tracker.core.model.Position;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * Decorates an {@link ExchangeGateway} with rate limiting, retry and a circuit breaker, and
 * records call latency and outcomes.
 *
 * <p>Chain: RateLimiter -> Retry -> CircuitBreaker -> delegate, with one chain for position
 * polls and another for ticker prices. Every failure, including an open breaker or an
 * exhausted rate limit, surfaces as {@link FetchException}.
 */
public final class ResilientExchangeGateway implements ExchangeGateway {
    private static final Logger logger = LoggerFactory.getLogger(ResilientExchangeGateway.class);

    static final String POSITIONS = "fetchPositions";
    static final String PRICES = "fetchReferencePrice";

    private final ExchangeGateway delegate;
    private final Guard positionsGuard;
    private final Guard pricesGuard;
    private final MeterRegistry meterRegistry;

    public ResilientExchangeGateway(ExchangeGateway delegate, MeterRegistry meterRegistry) {
        this(delegate, meterRegistry, Duration.ofMillis(500));
    }

    ResilientExchangeGateway(ExchangeGateway delegate, MeterRegistry meterRegistry, Duration retryWait) {
        this.delegate = delegate;
        this.meterRegistry = meterRegistry;
        String prefix = "exchange-" + delegate.name().toLowerCase() + "-";

        // Positions and tickers are guarded separately: a failing ticker must never
        // block the position poll.
        this.positionsGuard = Guard.create(prefix + "positions", retryWait);
        this.pricesGuard = Guard.create(prefix + "prices", retryWait);

        logger.info("ResilientExchangeGateway initialized for {} with circuit breaker, rate limiter, and retry",
            delegate.name());
    }

    /**
     * Circuit breaker, rate limiter and retry for one endpoint family.
     */
    private record Guard(CircuitBreaker circuitBreaker, RateLimiter rateLimiter, Retry retry) {

        static Guard create(String name, Duration retryWait) {
            // Open after 50% failures over the last 10 calls (5 minimum), half-open after 30s
            var cbConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .permittedNumberOfCallsInHalfOpenState(3)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .build();
            var circuitBreaker = CircuitBreaker.of(name, cbConfig);

            // MEXC allows 20 requests per 2 seconds per endpoint
            var rlConfig = RateLimiterConfig.custom()
                .limitForPeriod(20)
                .limitRefreshPeriod(Duration.ofSeconds(2))
                .timeoutDuration(Duration.ofSeconds(5))
                .build();

            var retryConfig = RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(retryWait)
                .retryExceptions(UncheckedFetchException.class)
                .build();

            circuitBreaker.getEventPublisher()
                .onStateTransition(event ->
                    logger.warn("Circuit breaker {} state changed: {}", name, event.getStateTransition()));

            return new Guard(circuitBreaker, RateLimiter.of(name, rlConfig), Retry.of(name, retryConfig));
        }
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public List<Position> fetchPositions() throws FetchException {
        return executeResilient(POSITIONS, positionsGuard, delegate::fetchPositions);
    }

    @Override
    public double fetchReferencePrice(String symbol) throws FetchException {
        return executeResilient(PRICES, pricesGuard, () -> delegate.fetchReferencePrice(symbol));
    }

    /**
     * @param operation {@link #POSITIONS} or {@link #PRICES}
     */
    public String circuitBreakerState(String operation) {
        Guard guard = PRICES.equals(operation) ? pricesGuard : positionsGuard;
        return guard.circuitBreaker().getState().name();
    }

    @FunctionalInterface
    private interface FetchCall<T> {
        T get() throws FetchException;
    }

    private <T> T executeResilient(String operation, Guard guard, FetchCall<T> call) throws FetchException {
        Supplier<T> supplier = () -> {
            try {
                return call.get();
            } catch (FetchException e) {
                throw new UncheckedFetchException(e);
            }
        };
        var decorated = RateLimiter.decorateSupplier(guard.rateLimiter(),
            Retry.decorateSupplier(guard.retry(),
                CircuitBreaker.decorateSupplier(guard.circuitBreaker(), supplier)));

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            T result = decorated.get();
            meterRegistry.counter("exchange.api.success", "operation", operation).increment();
            return result;
        } catch (UncheckedFetchException e) {
            recordFailure(operation, e.getCause());
            throw e.getCause();
        } catch (CallNotPermittedException e) {
            recordFailure(operation, e);
            throw new FetchException("Circuit breaker open, skipping " + operation, e);
        } catch (RequestNotPermitted e) {
            recordFailure(operation, e);
            throw new FetchException("Rate limit exceeded for " + operation, e);
        } catch (RuntimeException e) {
            recordFailure(operation, e);
            throw new FetchException(operation + " failed: " + e.getMessage(), e);
        } finally {
            sample.stop(Timer.builder("exchange.api.call")
                .tag("operation", operation)
                .register(meterRegistry));
        }
    }

    private void recordFailure(String operation, Exception e) {
        meterRegistry.counter("exchange.api.failure",
            "operation", operation,
            "error", e.getClass().getSimpleName()).increment();
        logger.debug("Exchange call {} failed after retries: {}", operation, e.getMessage());
    }

    private static final class UncheckedFetchException extends RuntimeException {
        UncheckedFetchException(FetchException cause) {
            super(cause.getMessage(), cause);
        }

        @Override
        public synchronized FetchException getCause() {
            return (FetchException) super.getCause();
        }
    }
}
