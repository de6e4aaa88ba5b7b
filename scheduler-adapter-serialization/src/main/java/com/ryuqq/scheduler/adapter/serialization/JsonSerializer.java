package com.ryuqq.scheduler.adapter.serialization;

import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * JSON Serializer.
 *
 * <p>사람이 읽을 수 있는 포맷이 필요하거나, 외부 시스템과 이벤트를 주고받을 때 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class JsonSerializer extends JacksonSerializer {

    public JsonSerializer() {
        super(new JsonMapper());
    }
}
