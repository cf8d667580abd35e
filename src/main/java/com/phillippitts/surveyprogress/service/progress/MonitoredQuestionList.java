package com.phillippitts.surveyprogress.service.progress;

import com.phillippitts.surveyprogress.domain.SurveyQuestion;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Latest-value view of the question list feeding the active session, with a swappable upstream.
 *
 * <p>The view is hot: it subscribes to the bound upstream as soon as it is bound, runs the bound
 * listener exactly once per upstream emission (however many subscribers there are), and replays
 * the latest list to late subscribers. {@link #rebind(Flux, Consumer)} replaces the upstream
 * without completing the view, so existing subscribers keep receiving lists from the new source.
 *
 * <p>An upstream error ends only that binding; the view stays open and keeps the last list.
 *
 * @since 0.1
 */
final class MonitoredQuestionList {

    private static final Logger LOG = LogManager.getLogger(MonitoredQuestionList.class);

    private final Sinks.Many<Binding> bindings = Sinks.many().replay().latest();
    private final Flux<List<SurveyQuestion>> questions;

    /**
     * Creates a view initially bound to {@code initialSource} with no listener.
     */
    MonitoredQuestionList(Flux<List<SurveyQuestion>> initialSource) {
        this.questions = bindings.asFlux()
                .switchMap(MonitoredQuestionList::observe)
                .replay(1)
                .autoConnect(0);
        rebind(initialSource, list -> { });
    }

    /**
     * Swaps the upstream. The previous upstream is cancelled; {@code listener} is invoked for every
     * list the new upstream emits.
     */
    synchronized void rebind(Flux<List<SurveyQuestion>> source, Consumer<List<SurveyQuestion>> listener) {
        Binding binding = new Binding(source, listener);
        Sinks.EmitResult result = bindings.tryEmitNext(binding);
        if (result.isFailure()) {
            throw new IllegalStateException("Failed to rebind question list source: " + result);
        }
    }

    /**
     * Returns the hot latest-value view of the question list.
     */
    Flux<List<SurveyQuestion>> questions() {
        return questions;
    }

    /**
     * Combines the question list with {@code other}; the combiner is re-evaluated whenever either
     * side publishes, once both have published at least once.
     */
    <T, R> Flux<R> combineWith(Flux<T> other, BiFunction<List<SurveyQuestion>, T, R> combiner) {
        return Flux.combineLatest(questions, other, combiner);
    }

    private static Flux<List<SurveyQuestion>> observe(Binding binding) {
        return binding.source()
                .doOnNext(binding.listener())
                .onErrorResume(e -> {
                    LOG.warn("Question list source failed; keeping last list: {}", e.toString());
                    return Flux.empty();
                });
    }

    private record Binding(Flux<List<SurveyQuestion>> source, Consumer<List<SurveyQuestion>> listener) {
        Binding {
            Objects.requireNonNull(source, "source must not be null");
            Objects.requireNonNull(listener, "listener must not be null");
        }
    }
}
