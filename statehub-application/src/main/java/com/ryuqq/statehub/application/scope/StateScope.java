package com.ryuqq.statehub.application.scope;

/**
 * StateStore / EventBus 인스턴스의 공유 범위.
 *
 * <ul>
 *   <li>SESSION: 세션(사용자 연결)마다 독립된 store/bus 쌍</li>
 *   <li>GLOBAL: 모든 세션이 하나의 store/bus 쌍을 공유</li>
 * </ul>
 *
 * @author StateHub Team
 * @since 1.0.0
 */
public enum StateScope {

    /** 세션별 격리. */
    SESSION,

    /** 프로세스 전역 공유. */
    GLOBAL
}
