package net.recache.adapter.jdbc.repo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.recache.adapter.jdbc.TxContext;
import net.recache.core.model.WorkMessage;
import net.recache.core.spi.WorkQueuePublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.PreparedStatement;

/**
 * 작업 큐 아웃박스. 메시지를 JSON 으로 TB_WORK_QUEUE 에 PENDING 으로 적재한다.
 * 브로커 전송은 별도 릴레이 몫이고, 여기서 커밋되면 발행 성공으로 본다.
 */
public final class JdbcWorkQueuePublisher implements WorkQueuePublisher {
    private static final Logger log = LoggerFactory.getLogger(JdbcWorkQueuePublisher.class);

    public static final String DEFAULT_ROUTING_KEY = "cache.generation";

    private final DataSource ds;
    private final ObjectMapper mapper;
    private final String routingKey;

    public JdbcWorkQueuePublisher(DataSource ds, ObjectMapper mapper) {
        this(ds, mapper, DEFAULT_ROUTING_KEY);
    }

    public JdbcWorkQueuePublisher(DataSource ds, ObjectMapper mapper, String routingKey) {
        if (routingKey == null || routingKey.isBlank()) throw new IllegalArgumentException("routingKey is required");
        this.ds = ds;
        this.mapper = mapper;
        this.routingKey = routingKey;
    }

    @Override
    public void publish(WorkMessage message) throws Exception {
        String payload = toJson(message);
        try (PreparedStatement ps = TxContext.required().prepareStatement("""
                INSERT INTO TB_WORK_QUEUE (JOB_ID, ITEM_ID, ROUTING_KEY, PAYLOAD, STATUS, CREATED_AT)
                VALUES (?, ?, ?, ?, 'PENDING', CURRENT_TIMESTAMP)
            """)) {
            ps.setString(1, message.jobId());
            ps.setString(2, message.itemId());
            ps.setString(3, routingKey);
            ps.setString(4, payload);
            ps.executeUpdate();
        }
        log.debug("Queued item {} of job {} on '{}'", message.itemId(), message.jobId(), routingKey);
    }

    public String routingKey() { return routingKey; }

    String toJson(WorkMessage message) throws JsonProcessingException {
        return mapper.writeValueAsString(message);
    }
}
