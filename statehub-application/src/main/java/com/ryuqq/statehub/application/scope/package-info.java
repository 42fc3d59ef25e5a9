/**
 * StateStore / EventBus 인스턴스 범위 관리.
 *
 * <p>호스트 애플리케이션이 store와 bus를 세션별로 격리할지, 전역으로 공유할지 선택할 수 있도록
 * 컨테이너와 provider를 제공합니다.</p>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.statehub.application.scope.StateScope} - SESSION / GLOBAL</li>
 *   <li>{@link com.ryuqq.statehub.application.scope.StateContainer} - store + bus 쌍, 함께 dispose</li>
 *   <li>{@link com.ryuqq.statehub.application.scope.StateContainerProvider} - 세션별 컨테이너 제공 포트</li>
 *   <li>{@link com.ryuqq.statehub.application.scope.ScopedStateContainerProvider} - 범위 기반 기본 구현</li>
 * </ul>
 *
 * @since 1.0.0
 * @author StateHub Team
 */
package com.ryuqq.statehub.application.scope;
