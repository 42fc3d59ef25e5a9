package com.ryuqq.statehub.core.model;

import java.util.List;
import java.util.Optional;

/**
 * 한 번의 mutation이 만들어낸 상태 변경 이벤트.
 *
 * <p>mutation 결과 하나 이상의 프로퍼티가 변경된 경우에만 생성되며,
 * change-event 채널로 발행되고 mutate 호출자에게 반환됩니다.</p>
 *
 * <p><strong>순서 보장:</strong> changedProperties는 mutation이 일어난 시간 순서가 아니라
 * 상태 타입에 선언된 프로퍼티 순서를 따릅니다.</p>
 *
 * @param state mutation 이후의 live 상태 인스턴스
 * @param changedProperties 변경된 프로퍼티 목록 (비어 있지 않음, 불변)
 * @param <T> 상태 타입
 *
 * @author StateHub Team
 * @since 1.0.0
 */
public record StateChange<T>(
    T state,
    List<PropertyChange> changedProperties
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException state 또는 changedProperties가 null이거나 비어 있는 경우
     */
    public StateChange {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (changedProperties == null || changedProperties.isEmpty()) {
            throw new IllegalArgumentException("changedProperties cannot be null or empty");
        }
        changedProperties = List.copyOf(changedProperties);
    }

    /**
     * 프로퍼티 이름으로 변경 내역 조회.
     *
     * @param propertyName 프로퍼티 이름
     * @return 변경 내역 (해당 프로퍼티가 변경되지 않았으면 empty)
     */
    public Optional<PropertyChange> find(String propertyName) {
        return changedProperties.stream()
            .filter(change -> change.propertyName().equals(propertyName))
            .findFirst();
    }

    /**
     * 특정 프로퍼티가 변경되었는지 확인.
     *
     * @param propertyName 프로퍼티 이름
     * @return 변경 여부
     */
    public boolean hasChanged(String propertyName) {
        return find(propertyName).isPresent();
    }
}
