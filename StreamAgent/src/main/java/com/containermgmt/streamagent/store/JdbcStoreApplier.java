package com.containermgmt.streamagent.store;

import com.containermgmt.streamagent.config.ActiveJDBCConfig;
import com.containermgmt.streamagent.dto.Batch;
import com.containermgmt.streamagent.dto.ChangeEvent;
import com.containermgmt.streamagent.dto.EventKind;
import com.containermgmt.streamagent.exception.FatalStoreException;
import com.containermgmt.streamagent.exception.StoreException;
import com.containermgmt.streamagent.exception.TransientStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.javalite.activejdbc.Base;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Store applier on ActiveJDBC.
 *
 * One transaction per batch. Each event first passes the sequence gate on
 * applied_entities, a conditional UPDATE that only moves last_applied_sequence
 * forward, and only then touches the files table.
 */
@Service
@Slf4j
public class JdbcStoreApplier implements StoreApplier {

    private static final String ADVANCE_SEQUENCE_SQL =
            "UPDATE applied_entities SET last_applied_sequence = ?, updated_at = ? " +
            "WHERE entity_id = ? AND last_applied_sequence < ?";

    private static final String SELECT_SEQUENCE_SQL =
            "SELECT last_applied_sequence FROM applied_entities WHERE entity_id = ?";

    private static final String INSERT_SEQUENCE_SQL =
            "INSERT INTO applied_entities (entity_id, last_applied_sequence, updated_at) VALUES (?, ?, ?)";

    private static final String FILE_EXISTS_SQL =
            "SELECT COUNT(*) FROM files WHERE entity_id = ?";

    private static final String UPDATE_FILE_SQL =
            "UPDATE files SET " +
            FilePayloadMapper.COLUMNS.stream().map(c -> c + " = ?").collect(Collectors.joining(", ")) +
            ", payload = ?, is_deleted = ?, updated_at = ? WHERE entity_id = ?";

    private static final String INSERT_FILE_SQL =
            "INSERT INTO files (entity_id, " + String.join(", ", FilePayloadMapper.COLUMNS) +
            ", payload, is_deleted, updated_at) VALUES (" +
            String.join(", ", Collections.nCopies(FilePayloadMapper.COLUMNS.size() + 4, "?")) + ")";

    private static final String MARK_DELETED_SQL =
            "UPDATE files SET is_deleted = ?, updated_at = ? WHERE entity_id = ?";

    private static final String INSERT_TOMBSTONE_SQL =
            "INSERT INTO files (entity_id, dir, name, is_deleted, updated_at) VALUES (?, '', '', ?, ?)";

    private final ActiveJDBCConfig activeJDBCConfig;
    private final FilePayloadMapper payloadMapper;
    private final StoreErrorClassifier errorClassifier;
    private final ObjectMapper objectMapper;

    public JdbcStoreApplier(ActiveJDBCConfig activeJDBCConfig,
                            FilePayloadMapper payloadMapper,
                            StoreErrorClassifier errorClassifier,
                            ObjectMapper objectMapper) {
        this.activeJDBCConfig = activeJDBCConfig;
        this.payloadMapper = payloadMapper;
        this.errorClassifier = errorClassifier;
        this.objectMapper = objectMapper;
    }

    @Override
    public ApplyResult apply(Batch batch) {
        String context = "batch " + batch.batchId();
        boolean connectionOpened = false;
        boolean transactionOpen = false;
        try {
            connectionOpened = activeJDBCConfig.openConnection();
            Base.openTransaction();
            transactionOpen = true;

            int applied = 0;
            int skipped = 0;
            for (ChangeEvent event : batch.events()) {
                if (applyEvent(event)) {
                    applied++;
                } else {
                    skipped++;
                }
            }

            Base.commitTransaction();
            transactionOpen = false;

            log.trace(" -- Committed {}: applied={}, skipped={}", context, applied, skipped);
            return new ApplyResult(applied, skipped);

        } catch (RuntimeException e) {
            StoreException failure = errorClassifier.classify(context, e);
            if (transactionOpen) {
                rollback(context, failure);
            }
            throw failure;
        } finally {
            if (connectionOpened) {
                activeJDBCConfig.closeConnection();
            }
        }
    }

    /**
     * @return true if the event was written, false if it was skipped
     */
    private boolean applyEvent(ChangeEvent event) {
        if (event.kind() == EventKind.UNKNOWN) {
            log.debug("Ignoring event of unsupported kind '{}' for entity {}", event.rawKind(), event.entityId());
            return false;
        }

        Timestamp now = Timestamp.from(Instant.now());
        if (!advanceSequence(event, now)) {
            log.debug("Skipping {} for entity {}: sequence {} already applied",
                    event.kind(), event.entityId(), event.sequence());
            return false;
        }

        switch (event.kind()) {
            case UPSERT:
                upsertFile(event, now);
                break;
            case DELETE:
                markDeleted(event, now);
                break;
            default:
                throw new IllegalStateException("Unhandled event kind " + event.kind());
        }
        return true;
    }

    /**
     * Compare-and-set on last_applied_sequence.
     *
     * @return true if the event is newer than anything applied for its entity
     */
    private boolean advanceSequence(ChangeEvent event, Timestamp now) {
        int updated = Base.exec(ADVANCE_SEQUENCE_SQL, event.sequence(), now, event.entityId(), event.sequence());
        if (updated > 0) {
            return true;
        }

        Object current = Base.firstCell(SELECT_SEQUENCE_SQL, event.entityId());
        if (current != null) {
            return false;
        }

        try {
            Base.exec(INSERT_SEQUENCE_SQL, event.entityId(), event.sequence(), now);
        } catch (RuntimeException e) {
            if (errorClassifier.isDuplicateKey(e)) {
                throw new TransientStoreException(
                        "Concurrent first write for entity " + event.entityId(), e);
            }
            throw e;
        }
        return true;
    }

    private void upsertFile(ChangeEvent event, Timestamp now) {
        List<Object> columns = payloadMapper.toColumnValues(event.entityId(), event.payload());
        String payloadJson = toJson(event);

        List<Object> params = new ArrayList<>(columns.size() + 4);
        if (fileExists(event.entityId())) {
            params.addAll(columns);
            params.add(payloadJson);
            params.add(Boolean.FALSE);
            params.add(now);
            params.add(event.entityId());
            Base.exec(UPDATE_FILE_SQL, params.toArray());
        } else {
            params.add(event.entityId());
            params.addAll(columns);
            params.add(payloadJson);
            params.add(Boolean.FALSE);
            params.add(now);
            Base.exec(INSERT_FILE_SQL, params.toArray());
        }
    }

    private void markDeleted(ChangeEvent event, Timestamp now) {
        if (fileExists(event.entityId())) {
            Base.exec(MARK_DELETED_SQL, Boolean.TRUE, now, event.entityId());
        } else {
            Base.exec(INSERT_TOMBSTONE_SQL, event.entityId(), Boolean.TRUE, now);
        }
    }

    private boolean fileExists(String entityId) {
        Object count = Base.firstCell(FILE_EXISTS_SQL, entityId);
        return count instanceof Number && ((Number) count).longValue() > 0;
    }

    private String toJson(ChangeEvent event) {
        Map<String, Object> payload = event.payload();
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new FatalStoreException("Payload of entity " + event.entityId() + " is not serializable", e);
        }
    }

    private void rollback(String context, StoreException failure) {
        try {
            Base.rollbackTransaction();
            log.debug("Rolled back {} after {}", context, failure.getClass().getSimpleName());
        } catch (RuntimeException rollbackError) {
            failure.addSuppressed(rollbackError);
            log.warn("Rollback of {} failed: {}", context, rollbackError.getMessage());
        }
    }
}
