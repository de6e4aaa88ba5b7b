package com.ryuqq.scheduler.core.model;

/**
 * Task의 전역 고유 식별자.
 *
 * <p>TaskId는 실행 가능한 작업 정의(Task)를 식별하며,
 * Schedule과 Job은 TaskId로 자신이 실행할 Task를 참조합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>공백 문자 불가</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TaskId {

    private final String value;

    private TaskId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("TaskId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("TaskId length cannot exceed 255 characters");
        }
        if (value.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("TaskId cannot contain whitespace characters");
        }
        this.value = value;
    }

    /**
     * TaskId 생성.
     *
     * @param value TaskId 값
     * @return TaskId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static TaskId of(String value) {
        return new TaskId(value);
    }

    /**
     * TaskId 값 조회.
     *
     * @return TaskId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskId taskId = (TaskId) o;
        return value.equals(taskId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "TaskId{" + value + '}';
    }
}
