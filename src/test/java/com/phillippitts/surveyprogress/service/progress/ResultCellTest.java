package com.phillippitts.surveyprogress.service.progress;

import com.phillippitts.surveyprogress.domain.AsyncResult;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultCellTest {

    @Test
    void shouldStartPendingByDefault() {
        ResultCell<String> cell = new ResultCell<>();

        assertThat(cell.current()).isEqualTo(AsyncResult.pending());
        assertThat(cell.version()).isZero();
    }

    @Test
    void shouldGiveLateSubscribersOnlyTheLatestValue() {
        ResultCell<String> cell = new ResultCell<>();
        cell.set(AsyncResult.success("first"));
        cell.set(AsyncResult.success("second"));

        StepVerifier.create(cell.asFlux().take(1))
                .expectNext(AsyncResult.success("second"))
                .verifyComplete();
    }

    @Test
    void shouldBroadcastUpdatesToAllSubscribers() {
        ResultCell<String> cell = new ResultCell<>(AsyncResult.success("initial"));
        List<AsyncResult<String>> a = new CopyOnWriteArrayList<>();
        List<AsyncResult<String>> b = new CopyOnWriteArrayList<>();
        cell.asFlux().subscribe(a::add);
        cell.asFlux().subscribe(b::add);

        IllegalStateException boom = new IllegalStateException("boom");
        cell.set(AsyncResult.failure(boom));

        assertThat(a).containsExactly(AsyncResult.success("initial"), AsyncResult.failure(boom));
        assertThat(b).containsExactly(AsyncResult.success("initial"), AsyncResult.failure(boom));
    }

    @Test
    void shouldCountEveryWriteEvenWhenValueIsUnchanged() {
        ResultCell<String> cell = new ResultCell<>();

        cell.set(AsyncResult.success("x"));
        cell.set(AsyncResult.success("x"));

        assertThat(cell.version()).isEqualTo(2);
    }

    @Test
    void shouldRejectNullValues() {
        ResultCell<String> cell = new ResultCell<>();

        assertThatThrownBy(() -> cell.set(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new ResultCell<String>(null)).isInstanceOf(NullPointerException.class);
    }
}
