package com.ryuqq.scheduler.adapter.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.util.function.Function;

/**
 * 문자열 값 하나를 감싼 값 객체를 JSON 문자열로 기록.
 *
 * @param <T> 값 객체 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class ValueObjectSerializer<T> extends StdSerializer<T> {

    private final Function<T, String> extractor;

    ValueObjectSerializer(Class<T> type, Function<T, String> extractor) {
        super(type);
        this.extractor = extractor;
    }

    @Override
    public void serialize(T value, JsonGenerator generator, SerializerProvider provider) throws IOException {
        generator.writeString(extractor.apply(value));
    }
}
