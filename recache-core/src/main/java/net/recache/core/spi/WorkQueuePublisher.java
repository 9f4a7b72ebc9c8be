package net.recache.core.spi;

import net.recache.core.model.WorkMessage;

/** at-least-once, 순서 보장 없음, ack는 노출하지 않음 */
public interface WorkQueuePublisher {
    void publish(WorkMessage message) throws Exception;
}
