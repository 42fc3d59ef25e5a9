package com.ryuqq.statehub.adapter.inmemory.store;

import com.ryuqq.statehub.core.change.ComparisonStrategy;

/**
 * InMemoryStateStore 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>comparisonStrategy: 속성 비교 방식 (기본 STRUCTURAL)</li>
 *   <li>lockGranularity: 변경 잠금 범위 (기본 GLOBAL)</li>
 * </ul>
 *
 * <p><strong>선택 가이드:</strong></p>
 * <ul>
 *   <li>중첩 객체/컬렉션을 제자리에서 수정하는 상태: STRUCTURAL 유지</li>
 *   <li>불변 값만 교체하는 상태: REFERENCE로 직렬화 비용 절감</li>
 *   <li>타입 간 변경 경합이 많은 경우: PER_TYPE</li>
 * </ul>
 *
 * @author StateHub Team
 * @since 1.0.0
 * @param comparisonStrategy 속성 비교 방식 (null 불가)
 * @param lockGranularity 변경 잠금 범위 (null 불가)
 */
public record StateStoreConfig(
    ComparisonStrategy comparisonStrategy,
    LockGranularity lockGranularity
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: comparisonStrategy=STRUCTURAL, lockGranularity=GLOBAL</p>
     */
    public StateStoreConfig() {
        this(ComparisonStrategy.STRUCTURAL, LockGranularity.GLOBAL);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public StateStoreConfig {
        if (comparisonStrategy == null) {
            throw new IllegalArgumentException("comparisonStrategy cannot be null");
        }
        if (lockGranularity == null) {
            throw new IllegalArgumentException("lockGranularity cannot be null");
        }
    }

    /**
     * comparisonStrategy만 변경한 새 인스턴스 생성.
     */
    public StateStoreConfig withComparisonStrategy(ComparisonStrategy comparisonStrategy) {
        return new StateStoreConfig(comparisonStrategy, lockGranularity);
    }

    /**
     * lockGranularity만 변경한 새 인스턴스 생성.
     */
    public StateStoreConfig withLockGranularity(LockGranularity lockGranularity) {
        return new StateStoreConfig(comparisonStrategy, lockGranularity);
    }
}
