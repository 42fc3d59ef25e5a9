package com.ryuqq.statehub.adapter.inmemory.bus;

import com.ryuqq.statehub.testkit.fixture.AnotherTestEvent;
import com.ryuqq.statehub.testkit.fixture.TestEvent;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.exceptions.OnErrorNotImplementedException;
import io.reactivex.rxjava3.observers.TestObserver;
import io.reactivex.rxjava3.plugins.RxJavaPlugins;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryEventBus 유닛 테스트.
 *
 * <p>구독자 수 집계와 RxJava 오류 라우팅 등 구현 세부사항을 검증합니다.</p>
 *
 * @author StateHub Team
 * @since 1.0.0
 */
class InMemoryEventBusTest {

    private InMemoryEventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new InMemoryEventBus();
    }

    @AfterEach
    void tearDown() {
        eventBus.dispose();
        RxJavaPlugins.reset();
    }

    @Test
    void subscriberCount_구독과_해지에_따라_변함() {
        // given
        assertThat(eventBus.subscriberCount(TestEvent.class)).isZero();

        // when
        Disposable first = eventBus.subscribeAction(TestEvent.class, event -> { });
        TestObserver<TestEvent> second = eventBus.subscribe(TestEvent.class, event -> event.value() > 0).test();

        // then
        assertThat(eventBus.subscriberCount(TestEvent.class)).isEqualTo(2);
        assertThat(eventBus.subscriberCount(AnotherTestEvent.class)).isZero();

        first.dispose();
        assertThat(eventBus.subscriberCount(TestEvent.class)).isEqualTo(1);
        second.dispose();
        assertThat(eventBus.subscriberCount(TestEvent.class)).isZero();
    }

    @Test
    void dispose_이후_subscriberCount는_0() {
        // given
        eventBus.subscribe(TestEvent.class).test();

        // when
        eventBus.dispose();

        // then
        assertThat(eventBus.subscriberCount(TestEvent.class)).isZero();
    }

    @Test
    void 원시_Observable_구독자_예외는_RxJavaPlugins로_전달되고_다른_구독자는_계속_수신() {
        // given
        List<Throwable> routed = new ArrayList<>();
        RxJavaPlugins.setErrorHandler(routed::add);
        List<Integer> received = new ArrayList<>();
        eventBus.subscribe(TestEvent.class).subscribe(event -> {
            throw new IllegalStateException("subscriber failed");
        });
        eventBus.subscribeAction(TestEvent.class, event -> received.add(event.value()));

        // when
        assertThatCode(() -> eventBus.publish(TestEvent.class, TestEvent.of(1))).doesNotThrowAnyException();
        eventBus.publish(TestEvent.class, TestEvent.of(2));

        // then
        assertThat(routed).hasSize(1);
        assertThat(routed.get(0))
            .isInstanceOf(OnErrorNotImplementedException.class)
            .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(received).containsExactly(1, 2);
        assertThat(eventBus.subscriberCount(TestEvent.class)).isEqualTo(1);
    }

    @Test
    void subscribeAction_predicate_예외도_삼켜지고_구독은_유지됨() {
        // given
        List<Integer> received = new ArrayList<>();
        eventBus.subscribeAction(TestEvent.class, event -> received.add(event.value()), event -> {
            if (event.value() == 1) {
                throw new IllegalArgumentException("bad predicate input");
            }
            return true;
        });

        // when
        eventBus.publish(TestEvent.class, TestEvent.of(1));
        eventBus.publish(TestEvent.class, TestEvent.of(2));

        // then
        assertThat(received).containsExactly(2);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    @Test
    void publish_타입과_다른_이벤트면_예외() {
        // given
        Class raw = TestEvent.class;

        // when & then
        assertThatThrownBy(() -> eventBus.publish(raw, new AnotherTestEvent(true)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void publish_Object_null은_dispose_이후에도_먼저_dispose_검사() {
        // given
        eventBus.dispose();

        // when & then
        assertThatThrownBy(() -> eventBus.publish(null))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("has been disposed");
    }

    @Test
    void subscribeAction_null_predicate면_예외() {
        assertThatThrownBy(() -> eventBus.subscribeAction(TestEvent.class, event -> { }, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("predicate cannot be null");
    }
}
