package com.ryuqq.statehub.core.model;

/**
 * 단일 최상위 프로퍼티의 변경 내역.
 *
 * <p>mutation 직전 스냅샷과 직후 값의 비교 키가 달라진 프로퍼티 하나를 나타냅니다.</p>
 *
 * <p><strong>값 규칙:</strong></p>
 * <ul>
 *   <li>oldValue: mutation 이전 값 (구조적 비교 시 스냅샷에서 복원된 사본, 복원 실패 시 null)</li>
 *   <li>newValue: mutation 이후의 live 값</li>
 *   <li>두 값 모두 null 가능 (null → 객체, 객체 → null 모두 변경으로 취급)</li>
 * </ul>
 *
 * @param propertyName 프로퍼티 이름 (예: homeAddress, tags)
 * @param oldValue 변경 전 값 (null 가능)
 * @param newValue 변경 후 값 (null 가능)
 *
 * @author StateHub Team
 * @since 1.0.0
 */
public record PropertyChange(
    String propertyName,
    Object oldValue,
    Object newValue
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException propertyName이 null이거나 빈 문자열인 경우
     */
    public PropertyChange {
        if (propertyName == null || propertyName.isBlank()) {
            throw new IllegalArgumentException("propertyName cannot be null or blank");
        }
    }

    /**
     * PropertyChange 생성.
     *
     * @param propertyName 프로퍼티 이름
     * @param oldValue 변경 전 값
     * @param newValue 변경 후 값
     * @return PropertyChange 인스턴스
     * @throws IllegalArgumentException propertyName이 null이거나 빈 문자열인 경우
     */
    public static PropertyChange of(String propertyName, Object oldValue, Object newValue) {
        return new PropertyChange(propertyName, oldValue, newValue);
    }

    /**
     * 변경 전 값을 지정한 타입으로 조회.
     *
     * @param type 기대 타입
     * @param <V> 값 타입
     * @return 변경 전 값 (null 가능)
     * @throws ClassCastException 값이 지정한 타입이 아닌 경우
     */
    public <V> V oldValueAs(Class<V> type) {
        return type.cast(oldValue);
    }

    /**
     * 변경 후 값을 지정한 타입으로 조회.
     *
     * @param type 기대 타입
     * @param <V> 값 타입
     * @return 변경 후 값 (null 가능)
     * @throws ClassCastException 값이 지정한 타입이 아닌 경우
     */
    public <V> V newValueAs(Class<V> type) {
        return type.cast(newValue);
    }
}
