package com.ryuqq.scheduler.core.spi;

/**
 * 값 인코딩 SPI.
 *
 * <p>Job 인자, 반환값, 이벤트를 프로세스 경계 너머로 보낼 때 사용합니다.
 * 구현은 {@code serialize(deserialize(serialize(x))) == serialize(x)}를 만족해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Serializer {

    /**
     * 값 인코딩.
     *
     * @param value 인코딩할 값
     * @return 인코딩된 바이트
     * @throws com.ryuqq.scheduler.core.exception.SerializationException 표현할 수 없는 값인 경우
     */
    byte[] serialize(Object value);

    /**
     * 값 디코딩.
     *
     * @param data 인코딩된 바이트
     * @param type 기대 타입
     * @param <T> 기대 타입
     * @return 디코딩된 값
     * @throws com.ryuqq.scheduler.core.exception.SerializationException 디코딩할 수 없는 경우
     */
    <T> T deserialize(byte[] data, Class<T> type);
}
