package com.containermgmt.streamagent.store;

import com.containermgmt.streamagent.config.ActiveJDBCConfig;
import com.containermgmt.streamagent.dto.Batch;
import com.containermgmt.streamagent.dto.ChangeEvent;
import com.containermgmt.streamagent.exception.FatalStoreException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class IngestErrorRecorderTest {

    private static StoreTestDatabase db;

    @BeforeAll
    static void createDatabase() {
        db = new StoreTestDatabase("recorder");
    }

    @BeforeEach
    void setUp() {
        db.clear();
    }

    @Test
    void recordsDroppedBatch() {
        IngestErrorRecorder recorder = new IngestErrorRecorder(db.activeJDBCConfig);
        Batch batch = new Batch("b7", "t7", List.of(
                ChangeEvent.upsert("f1", Map.of(), 1),
                ChangeEvent.upsert("f2", Map.of(), 1),
                ChangeEvent.delete("f1", 2)));

        recorder.record(batch, new FatalStoreException("Malformed payload for entity f2", null));

        Map<String, Object> row = db.jdbc.queryForMap("SELECT * FROM ingest_errors");
        assertThat(row.get("batch_id")).isEqualTo("b7");
        assertThat(row.get("ack_token")).isEqualTo("t7");
        assertThat(((Number) row.get("event_count")).intValue()).isEqualTo(3);
        assertThat(row.get("entity_ids")).isEqualTo("f1,f2");
        assertThat(row.get("error_class")).isEqualTo(FatalStoreException.class.getName());
        assertThat(row.get("error_message")).isEqualTo("Malformed payload for entity f2");
    }

    @Test
    void storeFailureIsLoggedNotThrown() {
        ActiveJDBCConfig broken = mock(ActiveJDBCConfig.class);
        when(broken.openConnection()).thenThrow(new IllegalStateException("pool closed"));
        IngestErrorRecorder recorder = new IngestErrorRecorder(broken);

        assertDoesNotThrow(() -> recorder.record(
                new Batch("b1", "t1", List.of()), new FatalStoreException("boom", null)));
    }
}
