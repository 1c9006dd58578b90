package com.containermgmt.streamagent.store;

import com.containermgmt.streamagent.config.ActiveJDBCConfig;
import com.containermgmt.streamagent.dto.Batch;
import com.containermgmt.streamagent.dto.ChangeEvent;
import lombok.extern.slf4j.Slf4j;
import org.javalite.activejdbc.Base;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Keeps an operator-visible trail of batches dropped because the store rejected
 * them. Best effort: a failure here is logged and never blocks the stream.
 */
@Component
@Slf4j
public class IngestErrorRecorder {

    private static final String INSERT_SQL =
            "INSERT INTO ingest_errors (batch_id, ack_token, event_count, entity_ids, error_class, error_message, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?)";

    private static final int MAX_ENTITY_IDS = 1024;
    private static final int MAX_MESSAGE = 2048;

    private final ActiveJDBCConfig activeJDBCConfig;

    public IngestErrorRecorder(ActiveJDBCConfig activeJDBCConfig) {
        this.activeJDBCConfig = activeJDBCConfig;
    }

    public void record(Batch batch, Throwable error) {
        boolean connectionOpened = false;
        try {
            connectionOpened = activeJDBCConfig.openConnection();
            Base.exec(INSERT_SQL,
                    batch.batchId(),
                    batch.ackToken(),
                    batch.size(),
                    truncate(entityIds(batch), MAX_ENTITY_IDS),
                    error.getClass().getName(),
                    truncate(error.getMessage(), MAX_MESSAGE),
                    Timestamp.from(Instant.now()));
            log.debug("Recorded ingest error for batch {}", batch.batchId());
        } catch (RuntimeException e) {
            log.warn("Could not record ingest error for batch {}: {}", batch.batchId(), e.getMessage(), e);
        } finally {
            if (connectionOpened) {
                activeJDBCConfig.closeConnection();
            }
        }
    }

    private static String entityIds(Batch batch) {
        return batch.events().stream()
                .map(ChangeEvent::entityId)
                .distinct()
                .collect(Collectors.joining(","));
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
