package com.ryuqq.scheduler.core.spi;

import java.util.function.BiConsumer;

/**
 * 프로세스 간 이벤트 전송 SPI (Redis pub/sub, MQTT 등).
 *
 * <p>전송 계층은 토픽 문자열과 인코딩된 바이트만 다루며, 발행자 자신을 포함한
 * 모든 구독자에게 알림을 전달해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface EventTransport {

    /**
     * 알림 발행.
     *
     * @param topic 토픽 문자열
     * @param payload 인코딩된 이벤트
     */
    void publish(String topic, byte[] payload);

    /**
     * 알림 구독.
     *
     * @param listener (토픽, 인코딩된 이벤트) 콜백
     * @return 구독 핸들
     */
    Subscription subscribe(BiConsumer<String, byte[]> listener);
}
