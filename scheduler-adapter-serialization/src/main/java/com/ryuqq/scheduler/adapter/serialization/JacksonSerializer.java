package com.ryuqq.scheduler.adapter.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ryuqq.scheduler.core.exception.SerializationException;
import com.ryuqq.scheduler.core.spi.Serializer;

import java.io.IOException;

/**
 * Jackson 기반 Serializer 공통 구현.
 *
 * <p>하위 클래스는 데이터 포맷(JSON, CBOR)에 맞는 {@link ObjectMapper}만 제공합니다.
 * 공통 설정:</p>
 * <ul>
 *   <li>java.time 타입은 ISO-8601 문자열 (타임스탬프 숫자 아님)</li>
 *   <li>스케줄러 값 객체와 Trigger 다형성은 {@link SchedulerModule}이 처리</li>
 *   <li>알 수 없는 속성은 무시 (버전 간 호환)</li>
 * </ul>
 *
 * <p>Jackson 예외는 모두 {@link SerializationException}으로 변환됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class JacksonSerializer implements Serializer {

    private final ObjectMapper mapper;

    protected JacksonSerializer(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = configure(mapper);
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper
            .registerModule(new JavaTimeModule())
            .registerModule(new SchedulerModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public byte[] serialize(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Cannot serialize value of type " + typeName(value), e);
        }
    }

    @Override
    public <T> T deserialize(byte[] data, Class<T> type) {
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        try {
            return mapper.readValue(data, type);
        } catch (IOException e) {
            throw new SerializationException("Cannot deserialize " + data.length + " bytes as " + type.getName(), e);
        }
    }

    /**
     * 설정이 적용된 ObjectMapper (하위 클래스와 테스트용).
     *
     * @return ObjectMapper
     */
    protected ObjectMapper getMapper() {
        return mapper;
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
