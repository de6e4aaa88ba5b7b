package com.ryuqq.scheduler.core.model;

import java.util.Arrays;

/**
 * 직렬화된 데이터 (불투명 바이트 배열).
 *
 * <p>Job 인자와 반환값은 {@link com.ryuqq.scheduler.core.spi.Serializer}로 인코딩된 뒤
 * Payload 형태로 DataStore 경계를 넘습니다. 코어는 내용을 해석하지 않습니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 시와 조회 시 모두 방어적 복사를 수행합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Payload {

    private static final Payload EMPTY = new Payload(new byte[0]);

    private final byte[] bytes;

    private Payload(byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("Payload bytes cannot be null");
        }
        this.bytes = bytes.clone();
    }

    /**
     * Payload 생성.
     *
     * @param bytes 인코딩된 바이트
     * @return Payload 인스턴스
     * @throws IllegalArgumentException bytes가 null인 경우
     */
    public static Payload of(byte[] bytes) {
        return new Payload(bytes);
    }

    /**
     * 빈 Payload.
     *
     * @return 길이 0인 Payload
     */
    public static Payload empty() {
        return EMPTY;
    }

    /**
     * 바이트 배열 조회 (복사본).
     *
     * @return 인코딩된 바이트 복사본
     */
    public byte[] getBytes() {
        return bytes.clone();
    }

    public int size() {
        return bytes.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Payload payload = (Payload) o;
        return Arrays.equals(bytes, payload.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "Payload{" + bytes.length + " bytes}";
    }
}
