package com.ryuqq.scheduler.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Task 함수에 전달되는 인자 (위치 인자 + 이름 인자).
 *
 * <p>Schedule 또는 Job에 저장될 때는 Serializer로 인코딩되어 {@link Payload}가 됩니다.
 * 값은 선택한 Serializer가 표현할 수 있는 타입이어야 합니다
 * (문자열, 숫자, 불리언, 리스트, 맵 등).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param positional 위치 인자 (null이면 빈 리스트)
 * @param named 이름 인자 (null이면 빈 맵, 삽입 순서 유지)
 */
public record JobArguments(List<Object> positional, Map<String, Object> named) {

    private static final JobArguments NONE = new JobArguments(List.of(), Map.of());

    public JobArguments {
        positional = positional == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(positional));
        named = named == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(named));
    }

    /**
     * 인자 없음.
     *
     * @return 빈 JobArguments
     */
    public static JobArguments none() {
        return NONE;
    }

    /**
     * 위치 인자로 생성.
     *
     * @param args 위치 인자
     * @return JobArguments 인스턴스
     */
    public static JobArguments of(Object... args) {
        return new JobArguments(Arrays.asList(args), Map.of());
    }

    /**
     * 이름 인자 하나를 추가한 새 인스턴스 생성.
     *
     * @param name 인자 이름
     * @param value 인자 값
     * @return 새 JobArguments
     */
    public JobArguments withNamed(String name, Object value) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Argument name cannot be null or blank");
        }
        Map<String, Object> copy = new LinkedHashMap<>(named);
        copy.put(name, value);
        return new JobArguments(positional, copy);
    }

    /**
     * 위치 인자 조회.
     *
     * @param index 인덱스
     * @return 인자 값
     * @throws IndexOutOfBoundsException 범위를 벗어난 경우
     */
    public Object positionalAt(int index) {
        return positional.get(index);
    }

    /**
     * 이름 인자 조회.
     *
     * @param name 인자 이름
     * @return 인자 값 (없으면 null)
     */
    public Object namedValue(String name) {
        return named.get(name);
    }
}
