package com.ryuqq.statehub.adapter.inmemory.store;

/**
 * 변경(mutate) 잠금의 범위.
 *
 * <ul>
 *   <li>GLOBAL: 모든 상태 타입이 하나의 잠금을 공유 (기본값)</li>
 *   <li>PER_TYPE: 상태 타입마다 독립된 잠금 사용</li>
 * </ul>
 *
 * <p>어느 쪽이든 같은 타입에 대한 snapshot → update → diff → publish 순서는 원자적으로 실행됩니다.
 * PER_TYPE은 서로 다른 타입의 변경이 병렬로 진행될 수 있다는 점만 다릅니다.</p>
 *
 * @author StateHub Team
 * @since 1.0.0
 */
public enum LockGranularity {

    /** 모든 타입이 하나의 잠금을 공유. */
    GLOBAL,

    /** 타입별 잠금. */
    PER_TYPE
}
