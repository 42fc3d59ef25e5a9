package com.ryuqq.statehub.application.scope;

/**
 * 세션에 맞는 StateContainer를 제공하는 포트.
 *
 * <p>호스트(웹 프레임워크, 소켓 서버 등)는 연결이 시작될 때 {@link #containerFor(String)}로
 * 컨테이너를 얻고, 연결이 끝나면 {@link #endSession(String)}을 호출합니다.</p>
 *
 * <p><strong>범위별 동작:</strong></p>
 * <pre>
 * SESSION:
 *   containerFor("a") → 컨테이너 A (최초 호출 시 생성)
 *   containerFor("b") → 컨테이너 B (A와 격리)
 *   endSession("a")   → A close
 *
 * GLOBAL:
 *   containerFor("a") == containerFor("b") → 하나의 공유 컨테이너
 *   endSession("a")   → 아무 일도 일어나지 않음
 * </pre>
 *
 * @author StateHub Team
 * @since 1.0.0
 */
public interface StateContainerProvider extends AutoCloseable {

    /**
     * 세션의 컨테이너 조회 (없으면 생성).
     *
     * @param sessionId 세션 식별자
     * @return 해당 세션이 사용할 컨테이너
     * @throws IllegalArgumentException sessionId가 null이거나 빈 문자열인 경우
     * @throws IllegalStateException provider가 닫힌 경우
     */
    StateContainer containerFor(String sessionId);

    /**
     * 세션 종료.
     *
     * <p>SESSION 범위에서는 해당 세션의 컨테이너를 닫고 제거합니다.
     * 존재하지 않는 세션이면 아무 일도 하지 않습니다.</p>
     *
     * @param sessionId 세션 식별자
     * @throws IllegalArgumentException sessionId가 null이거나 빈 문자열인 경우
     */
    void endSession(String sessionId);

    /**
     * 현재 살아 있는 컨테이너 수.
     *
     * @return 컨테이너 수
     */
    int activeContainerCount();

    /**
     * provider의 공유 범위.
     *
     * @return StateScope
     */
    StateScope scope();

    /**
     * 모든 컨테이너를 닫음. 여러 번 호출해도 안전합니다.
     */
    @Override
    void close();
}
