package com.ryuqq.scheduler.adapter.serialization;

import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;

/**
 * CBOR (RFC 8949) Serializer.
 *
 * <p>JSON과 같은 데이터 모델의 바이너리 인코딩입니다. Payload 같은 바이트 값을
 * base64 없이 그대로 담을 수 있어 크기가 작습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CborSerializer extends JacksonSerializer {

    public CborSerializer() {
        super(new CBORMapper());
    }
}
