package com.ryuqq.statehub.adapter.inmemory.store;

import com.ryuqq.statehub.core.change.ChangeDetector;
import com.ryuqq.statehub.core.change.ComparisonStrategy;
import com.ryuqq.statehub.core.model.PropertyChange;
import com.ryuqq.statehub.core.model.StateChange;
import com.ryuqq.statehub.testkit.fixture.Address;
import com.ryuqq.statehub.testkit.fixture.AnotherTestState;
import com.ryuqq.statehub.testkit.fixture.TestState;
import com.ryuqq.statehub.testkit.fixture.UserProfile;
import io.reactivex.rxjava3.observers.TestObserver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * InMemoryStateStore 유닛 테스트.
 *
 * <p>계약 테스트가 다루지 않는 구현 세부사항을 검증합니다:</p>
 * <ul>
 *   <li>ChangeDetector 호출 순서 (snapshot → update → diff)</li>
 *   <li>REFERENCE 비교 전략</li>
 *   <li>GLOBAL / PER_TYPE 잠금 범위</li>
 *   <li>생성자 검증 및 기본 생성 실패</li>
 * </ul>
 *
 * @author StateHub Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class InMemoryStateStoreTest {

    @Mock
    private ChangeDetector changeDetector;

    private InMemoryStateStore store;

    @AfterEach
    void tearDown() {
        if (store != null) {
            store.dispose();
        }
    }

    // ============================================================
    // 1. ChangeDetector 연동
    // ============================================================

    @Test
    void mutate_snapshot_update_diff_순서로_호출됨() {
        // given
        when(changeDetector.strategy()).thenReturn(ComparisonStrategy.STRUCTURAL);
        store = new InMemoryStateStore(new StateStoreConfig(), changeDetector);
        @SuppressWarnings("unchecked")
        Consumer<TestState> update = mock(Consumer.class);

        // when
        store.mutate(TestState.class, update);

        // then
        TestState state = store.get(TestState.class);
        InOrder order = inOrder(changeDetector, update);
        order.verify(changeDetector).snapshot(TestState.class, state);
        order.verify(update).accept(state);
        order.verify(changeDetector).diff(eq(TestState.class), any(), eq(state));
    }

    @Test
    void mutate_diff_결과가_비어있으면_변경_이벤트_없음() {
        // given
        when(changeDetector.strategy()).thenReturn(ComparisonStrategy.STRUCTURAL);
        when(changeDetector.diff(eq(TestState.class), any(), any())).thenReturn(List.of());
        store = new InMemoryStateStore(new StateStoreConfig(), changeDetector);
        TestObserver<StateChange<TestState>> changes = store.observeChanges(TestState.class).test();

        // when
        Optional<StateChange<TestState>> result = store.mutate(TestState.class, state -> state.setCounter(1));

        // then
        assertThat(result).isEmpty();
        changes.assertNoValues();
    }

    @Test
    void mutate_diff_결과를_그대로_StateChange로_발행함() {
        // given
        PropertyChange counter = PropertyChange.of("counter", 0, 1);
        when(changeDetector.strategy()).thenReturn(ComparisonStrategy.STRUCTURAL);
        when(changeDetector.diff(eq(TestState.class), any(), any())).thenReturn(List.of(counter));
        store = new InMemoryStateStore(new StateStoreConfig(), changeDetector);
        TestObserver<StateChange<TestState>> changes = store.observeChanges(TestState.class).test();

        // when
        StateChange<TestState> change = store.mutate(TestState.class, state -> state.setCounter(1)).orElseThrow();

        // then
        assertThat(change.changedProperties()).containsExactly(counter);
        changes.assertValues(change);
    }

    @Test
    void mutate_diff_예외_발생시_잠금_해제되고_예외_전파됨() {
        // given
        when(changeDetector.strategy()).thenReturn(ComparisonStrategy.STRUCTURAL);
        when(changeDetector.diff(eq(TestState.class), any(), any()))
            .thenThrow(new IllegalStateException("diff failed"))
            .thenReturn(List.of());
        store = new InMemoryStateStore(new StateStoreConfig(), changeDetector);

        // when & then
        assertThatThrownBy(() -> store.mutate(TestState.class, state -> state.setCounter(1)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("diff failed");
        assertThat(store.mutate(TestState.class, state -> state.setCounter(2))).isEmpty();
        verify(changeDetector, times(2)).diff(eq(TestState.class), any(), any());
    }

    // ============================================================
    // 2. 비교 전략
    // ============================================================

    @Test
    void REFERENCE_전략은_중첩_객체_제자리_수정을_감지하지_않음() {
        // given
        store = new InMemoryStateStore(new StateStoreConfig().withComparisonStrategy(ComparisonStrategy.REFERENCE));

        // when
        Optional<StateChange<UserProfile>> result = store.mutate(UserProfile.class,
            profile -> profile.getHomeAddress().setCity("Busan"));

        // then
        assertThat(result).isEmpty();
    }

    @Test
    void REFERENCE_전략은_중첩_객체_교체를_감지함() {
        // given
        store = new InMemoryStateStore(new StateStoreConfig().withComparisonStrategy(ComparisonStrategy.REFERENCE));
        Address previous = store.get(UserProfile.class).getHomeAddress();
        Address next = new Address("1 Main St", "Busan", "48000");

        // when
        StateChange<UserProfile> change = store.mutate(UserProfile.class,
            profile -> profile.setHomeAddress(next)).orElseThrow();

        // then
        PropertyChange homeAddress = change.find("homeAddress").orElseThrow();
        assertThat(homeAddress.oldValue()).isSameAs(previous);
        assertThat(homeAddress.newValue()).isSameAs(next);
    }

    // ============================================================
    // 3. 잠금 범위
    // ============================================================

    @Test
    void PER_TYPE_잠금은_다른_타입의_변경을_막지_않음() throws Exception {
        // given
        store = new InMemoryStateStore(new StateStoreConfig().withLockGranularity(LockGranularity.PER_TYPE));
        CompletableFuture<Void> gate = new CompletableFuture<>();
        CompletableFuture<Optional<StateChange<TestState>>> pending = store.mutateAsync(TestState.class,
            state -> gate.thenRun(() -> state.setCounter(1)));

        // when
        Optional<StateChange<AnotherTestState>> other = store.mutate(AnotherTestState.class,
            state -> state.setEnabled(true));

        // then
        assertThat(other).isPresent();
        assertThat(pending).isNotDone();

        gate.complete(null);
        assertThat(pending.get(5, TimeUnit.SECONDS)).isPresent();
    }

    @Test
    void GLOBAL_잠금은_다른_타입의_변경도_대기시킴() throws Exception {
        // given
        store = new InMemoryStateStore();
        CompletableFuture<Void> gate = new CompletableFuture<>();
        CompletableFuture<Optional<StateChange<TestState>>> pending = store.mutateAsync(TestState.class,
            state -> gate.thenRun(() -> state.setCounter(1)));
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            // when
            Future<Optional<StateChange<AnotherTestState>>> other = executor.submit(
                () -> store.mutate(AnotherTestState.class, state -> state.setEnabled(true)));

            // then
            assertThatThrownBy(() -> other.get(200, TimeUnit.MILLISECONDS)).isInstanceOf(TimeoutException.class);

            gate.complete(null);
            assertThat(pending.get(5, TimeUnit.SECONDS)).isPresent();
            assertThat(other.get(5, TimeUnit.SECONDS)).isPresent();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void 기본_설정은_STRUCTURAL_GLOBAL() {
        // when
        store = new InMemoryStateStore();

        // then
        assertThat(store.config().comparisonStrategy()).isEqualTo(ComparisonStrategy.STRUCTURAL);
        assertThat(store.config().lockGranularity()).isEqualTo(LockGranularity.GLOBAL);
    }

    // ============================================================
    // 4. 생성자 및 기본 생성
    // ============================================================

    @Test
    void 생성자_null_설정이면_예외() {
        assertThatThrownBy(() -> new InMemoryStateStore(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("config cannot be null");
    }

    @Test
    void 생성자_전략이_다른_ChangeDetector이면_예외() {
        // given
        when(changeDetector.strategy()).thenReturn(ComparisonStrategy.REFERENCE);

        // when & then
        assertThatThrownBy(() -> new InMemoryStateStore(new StateStoreConfig(), changeDetector))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("does not match");
    }

    @Test
    void 생성자에서_예외가_나는_타입은_IllegalArgumentException으로_감쌈() {
        // given
        store = new InMemoryStateStore();

        // when & then
        assertThatThrownBy(() -> store.get(ExplodingState.class))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining(ExplodingState.class.getName())
            .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void private_생성자를_가진_타입도_생성됨() {
        // given
        store = new InMemoryStateStore();

        // when
        PrivateConstructorState state = store.get(PrivateConstructorState.class);

        // then
        assertThat(state.getValue()).isEqualTo("initial");
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    @Test
    void replace_타입과_다른_인스턴스면_예외() {
        // given
        store = new InMemoryStateStore();
        Class raw = TestState.class;

        // when & then
        assertThatThrownBy(() -> store.replace(raw, new AnotherTestState()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void dispose_이후_contains_호출시_예외() {
        // given
        store = new InMemoryStateStore();
        store.get(TestState.class);

        // when
        store.dispose();

        // then
        assertThat(store.isDisposed()).isTrue();
        assertThatThrownBy(() -> store.contains(TestState.class))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("has been disposed");
    }

    static class ExplodingState {
        ExplodingState() {
            throw new IllegalStateException("cannot initialize");
        }
    }

    static class PrivateConstructorState {
        private final String value;

        private PrivateConstructorState() {
            this.value = "initial";
        }

        public String getValue() {
            return value;
        }
    }
}
