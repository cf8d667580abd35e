package com.phillippitts.surveyprogress.service.progress;

import com.phillippitts.surveyprogress.domain.AsyncResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Objects;

/**
 * Single-slot broadcast holder for the latest {@link AsyncResult}.
 *
 * <p>Every {@link #set(AsyncResult)} overwrites the slot and is broadcast to all current
 * subscribers of {@link #asFlux()}. New subscribers receive only the latest value, never history.
 *
 * <p>Writes are serialized on the cell's monitor so that the current value, the version and the
 * emission order always agree. {@link #version()} counts writes after construction and lets callers
 * detect whether a value was re-published.
 *
 * @param <T> type of the successful value
 */
public final class ResultCell<T> {

    private static final Logger LOG = LogManager.getLogger(ResultCell.class);

    private final Sinks.Many<AsyncResult<T>> sink = Sinks.many().replay().latest();
    private volatile AsyncResult<T> current;
    private volatile long version;

    /**
     * Creates a cell holding {@link AsyncResult#pending()}.
     */
    public ResultCell() {
        this(AsyncResult.pending());
    }

    /**
     * Creates a cell holding {@code initial}.
     *
     * @param initial initial value (must not be null)
     */
    public ResultCell(AsyncResult<T> initial) {
        Objects.requireNonNull(initial, "initial must not be null");
        this.current = initial;
        emit(initial);
    }

    /**
     * Overwrites the slot and broadcasts the new value.
     *
     * @param value new value (must not be null)
     */
    public synchronized void set(AsyncResult<T> value) {
        Objects.requireNonNull(value, "value must not be null");
        current = value;
        version++;
        emit(value);
    }

    /**
     * Returns the latest value without subscribing.
     */
    public AsyncResult<T> current() {
        return current;
    }

    /**
     * Returns the number of {@link #set(AsyncResult)} calls since construction.
     */
    public long version() {
        return version;
    }

    /**
     * Returns a hot latest-value view: the current value first, then every later update.
     */
    public Flux<AsyncResult<T>> asFlux() {
        return sink.asFlux();
    }

    private void emit(AsyncResult<T> value) {
        Sinks.EmitResult result = sink.tryEmitNext(value);
        if (result.isFailure()) {
            // Only reachable on re-entrant emission from a subscriber; the slot still holds the value.
            LOG.warn("Result cell emission dropped: result={}, value={}", result, value);
        }
    }
}
