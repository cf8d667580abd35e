package com.phillippitts.surveyprogress.service.progress;

import com.phillippitts.surveyprogress.domain.SurveyQuestion;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static com.phillippitts.surveyprogress.testutil.TestQuestions.Q0;
import static com.phillippitts.surveyprogress.testutil.TestQuestions.Q1;
import static com.phillippitts.surveyprogress.testutil.TestQuestions.Q2;
import static org.assertj.core.api.Assertions.assertThat;

class MonitoredQuestionListTest {

    @Test
    void shouldReplayInitialSourceToLateSubscribers() {
        MonitoredQuestionList monitored = new MonitoredQuestionList(Flux.just(List.of()));

        assertThat(monitored.questions().blockFirst()).isEmpty();
    }

    @Test
    void shouldKeepSubscribersAcrossRebind() {
        MonitoredQuestionList monitored = new MonitoredQuestionList(Flux.just(List.of()));
        List<List<SurveyQuestion>> seen = new CopyOnWriteArrayList<>();
        monitored.questions().subscribe(seen::add);

        monitored.rebind(Flux.just(List.of(Q0)), list -> { });
        monitored.rebind(Flux.just(List.of(Q1, Q2)), list -> { });

        assertThat(seen).containsExactly(List.of(), List.of(Q0), List.of(Q1, Q2));
    }

    @Test
    void shouldInvokeListenerOncePerEmissionRegardlessOfSubscribers() {
        MonitoredQuestionList monitored = new MonitoredQuestionList(Flux.just(List.of()));
        monitored.questions().subscribe();
        monitored.questions().subscribe();
        AtomicInteger calls = new AtomicInteger();
        Sinks.Many<List<SurveyQuestion>> upstream = Sinks.many().multicast().directBestEffort();

        monitored.rebind(upstream.asFlux(), list -> calls.incrementAndGet());
        upstream.tryEmitNext(List.of(Q0));
        upstream.tryEmitNext(List.of(Q1));

        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void shouldStopListeningToPreviousSourceAfterRebind() {
        MonitoredQuestionList monitored = new MonitoredQuestionList(Flux.just(List.of()));
        Sinks.Many<List<SurveyQuestion>> old = Sinks.many().multicast().directBestEffort();
        AtomicInteger oldCalls = new AtomicInteger();
        monitored.rebind(old.asFlux(), list -> oldCalls.incrementAndGet());

        monitored.rebind(Flux.just(List.of(Q2)), list -> { });
        old.tryEmitNext(List.of(Q0));

        assertThat(oldCalls.get()).isZero();
        assertThat(monitored.questions().blockFirst()).containsExactly(Q2);
    }

    @Test
    void shouldSurviveUpstreamError() {
        MonitoredQuestionList monitored = new MonitoredQuestionList(Flux.just(List.of(Q0)));

        monitored.rebind(Flux.error(new IllegalStateException("offline")), list -> { });
        assertThat(monitored.questions().blockFirst()).containsExactly(Q0);

        monitored.rebind(Flux.just(List.of(Q1)), list -> { });
        assertThat(monitored.questions().blockFirst()).containsExactly(Q1);
    }

    @Test
    void shouldRecombineWhenEitherSideChanges() {
        MonitoredQuestionList monitored = new MonitoredQuestionList(Flux.just(List.of(Q0)));
        Sinks.Many<String> other = Sinks.many().replay().latest();
        other.tryEmitNext("a");
        List<String> combined = new CopyOnWriteArrayList<>();

        monitored.combineWith(other.asFlux(), (questions, value) -> questions.size() + value)
                .subscribe(combined::add);
        other.tryEmitNext("b");
        monitored.rebind(Flux.just(List.of(Q0, Q1)), list -> { });

        assertThat(combined).containsExactly("1a", "1b", "2b");
    }
}
