package com.ryuqq.scheduler.adapter.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.util.function.Function;

/**
 * JSON 문자열을 값 객체로 복원. 값 객체의 검증 실패는 역직렬화 오류로 보고합니다.
 *
 * @param <T> 값 객체 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class ValueObjectDeserializer<T> extends StdDeserializer<T> {

    private final Function<String, T> factory;

    ValueObjectDeserializer(Class<T> type, Function<String, T> factory) {
        super(type);
        this.factory = factory;
    }

    @Override
    @SuppressWarnings("unchecked")
    public T deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        if (parser.currentToken() != JsonToken.VALUE_STRING) {
            return (T) context.handleUnexpectedToken(handledType(), parser);
        }
        String text = parser.getText();
        try {
            return factory.apply(text);
        } catch (IllegalArgumentException e) {
            return (T) context.handleWeirdStringValue(handledType(), text, e.getMessage());
        }
    }
}
