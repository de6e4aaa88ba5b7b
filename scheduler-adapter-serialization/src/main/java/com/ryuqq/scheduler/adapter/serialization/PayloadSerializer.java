package com.ryuqq.scheduler.adapter.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.ryuqq.scheduler.core.model.Payload;

import java.io.IOException;

/**
 * Payload를 바이너리 값으로 기록 (JSON은 base64, CBOR는 byte string).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class PayloadSerializer extends StdSerializer<Payload> {

    PayloadSerializer() {
        super(Payload.class);
    }

    @Override
    public void serialize(Payload value, JsonGenerator generator, SerializerProvider provider) throws IOException {
        generator.writeBinary(value.getBytes());
    }
}
