package com.ryuqq.scheduler.adapter.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.ryuqq.scheduler.core.model.Payload;

import java.io.IOException;

/**
 * 바이너리 값을 Payload로 복원.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class PayloadDeserializer extends StdDeserializer<Payload> {

    PayloadDeserializer() {
        super(Payload.class);
    }

    @Override
    public Payload deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        return Payload.of(parser.getBinaryValue());
    }
}
