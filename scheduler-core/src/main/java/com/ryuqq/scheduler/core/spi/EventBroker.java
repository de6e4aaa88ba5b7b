package com.ryuqq.scheduler.core.spi;

import com.ryuqq.scheduler.core.event.Event;
import com.ryuqq.scheduler.core.event.EventTopic;

import java.util.Set;
import java.util.function.Consumer;

/**
 * 이벤트 발행/구독 SPI.
 *
 * <p><strong>전달 보장:</strong></p>
 * <ul>
 *   <li>한 프로세스 안에서는 한 발행자가 보낸 같은 토픽 이벤트의 순서를 유지</li>
 *   <li>프로세스 간 전달은 최소 1회(at-least-once), 토픽 간 순서 보장 없음</li>
 *   <li>구독자 콜백의 예외는 발행자나 다른 구독자에게 전파되지 않음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface EventBroker {

    void start();

    void stop();

    /**
     * 이벤트 발행 (외부 전송이 있으면 다른 프로세스에도 전달).
     *
     * @param event 발행할 이벤트
     */
    void publish(Event event);

    /**
     * 이 프로세스의 구독자에게만 이벤트 전달.
     *
     * @param event 전달할 이벤트
     */
    void publishLocal(Event event);

    /**
     * 이벤트 구독.
     *
     * @param callback 이벤트 콜백
     * @param topics 구독할 토픽 (비어 있으면 전체)
     * @param oneShot true이면 첫 이벤트 전달 후 자동 해제
     * @return 구독 핸들
     */
    Subscription subscribe(Consumer<? super Event> callback, Set<EventTopic> topics, boolean oneShot);

    default Subscription subscribe(Consumer<? super Event> callback, Set<EventTopic> topics) {
        return subscribe(callback, topics, false);
    }
}
