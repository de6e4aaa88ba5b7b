package com.ryuqq.scheduler.core.model;

/**
 * 실행 대상 함수에 대한 불투명(opaque) 참조.
 *
 * <p>코어는 이 값을 해석하지 않습니다. 해석은 워커 측
 * {@link com.ryuqq.scheduler.core.executor.CallableResolver}가 담당합니다.</p>
 *
 * <p><strong>관례적인 형식:</strong></p>
 * <ul>
 *   <li>{@code com.acme.Jobs::tick} - 클래스의 public static 메서드</li>
 *   <li>{@code com.acme.TickFunction} - TaskFunction 구현 클래스</li>
 *   <li>그 외 문자열 - 프로세스 내 등록소(registry) 키</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CallableRef {

    private final String value;

    private CallableRef(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("CallableRef cannot be null or blank");
        }
        this.value = value;
    }

    public static CallableRef of(String value) {
        return new CallableRef(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CallableRef that = (CallableRef) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "CallableRef{" + value + '}';
    }
}
