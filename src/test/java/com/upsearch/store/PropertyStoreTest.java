package com.upsearch.store;

import com.upsearch.PropertyDatabase;
import com.upsearch.model.PropertyRecord;
import com.upsearch.support.FailingDataSource;
import com.upsearch.support.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PropertyStoreTest {

    @TempDir
    Path tempDir;

    private PropertyDatabase database;
    private PropertyStore store;

    @BeforeEach
    void setUp() {
        database = TestDatabase.open(tempDir);
        store = database.getStore();
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    private int insert(List<PropertyRecord> records) throws SQLException {
        try (Connection conn = database.getDataSource().getConnection()) {
            conn.setAutoCommit(false);
            int inserted = store.insertIfAbsent(conn, records);
            conn.commit();
            return inserted;
        }
    }

    private static PropertyRecord record(String id, String owner) {
        return PropertyRecord.builder(id).ownerName(owner).ownerCity("SACRAMENTO")
            .amountReported(new BigDecimal("12.50")).rawPayload("{}").build();
    }

    @Nested
    class InsertTests {

        @Test
        void shouldInsertNewRecords() throws SQLException {
            int inserted = insert(List.of(record("P1", "SMITH"), record("P2", "JONES")));

            assertThat(inserted).isEqualTo(2);
            assertThat(store.count()).isEqualTo(2);
            assertThat(store.maxSeq()).isEqualTo(2);
        }

        @Test
        void shouldKeepFirstVersionOfDuplicateId() throws SQLException {
            // Given
            insert(List.of(record("P1", "SMITH")));

            // When
            int inserted = insert(List.of(record("P1", "JONES")));

            // Then
            assertThat(inserted).isZero();
            assertThat(store.findById("P1")).map(PropertyRecord::getOwnerName).contains("SMITH");
        }

        @Test
        void shouldKeepFirstVersionOfDuplicateWithinOneBatch() throws SQLException {
            int inserted = insert(List.of(record("P1", "SMITH"), record("P1", "JONES"), record("P2", "LEE")));

            assertThat(inserted).isEqualTo(2);
            assertThat(store.findById("P1")).map(PropertyRecord::getOwnerName).contains("SMITH");
        }

        @Test
        void shouldDiscardRowsOnRollback() throws SQLException {
            try (Connection conn = database.getDataSource().getConnection()) {
                conn.setAutoCommit(false);
                store.insertIfAbsent(conn, List.of(record("P1", "SMITH")));
                conn.rollback();
            }

            assertThat(store.count()).isZero();
        }

        @Test
        void shouldReturnZeroForEmptyBatch() throws SQLException {
            assertThat(insert(List.of())).isZero();
        }
    }

    @Nested
    class LookupTests {

        @Test
        void shouldRoundTripAllFields() throws SQLException {
            PropertyRecord original = PropertyRecord.builder("P7")
                .ownerName("SMITH JOHN").ownerAddress("1 MAIN ST").ownerCity("FRESNO").ownerState("CA")
                .ownerZip("93650").amountReported(new BigDecimal("1234.56")).cashReported("Y")
                .propertyType("CHECKING").holderName("ACME BANK").holderAddress("PO BOX 1")
                .reportedDate("2020-01-15").rawPayload("{\"PROPERTY_ID\": \"P7\"}")
                .build();
            insert(List.of(original));

            assertThat(store.findById("P7")).contains(original);
        }

        @Test
        void shouldReturnEmptyForUnknownId() {
            assertThat(store.findById("NOPE")).isEmpty();
        }

        @Test
        void shouldReturnBatchInRequestedOrder() throws SQLException {
            insert(List.of(record("A", "X"), record("B", "Y"), record("C", "Z")));

            List<PropertyRecord> found = store.findByIds(List.of("C", "MISSING", "A"));

            assertThat(found).extracting(PropertyRecord::getPropertyId).containsExactly("C", "A");
        }

        @Test
        void shouldLookUpMoreIdsThanOneInClause() throws SQLException {
            List<PropertyRecord> records = new ArrayList<>();
            List<String> ids = new ArrayList<>();
            for (int i = 0; i < 1200; i++) {
                records.add(record("P" + i, "OWNER"));
                ids.add("P" + i);
            }
            insert(records);

            assertThat(store.findByIds(ids)).hasSize(1200);
        }
    }

    @Nested
    class ErrorHandlingTests {

        @Test
        void shouldWrapConnectionFailure() {
            FailingDataSource failing = new FailingDataSource();
            PropertyStore broken = new PropertyStore(failing);

            assertThatThrownBy(() -> broken.findById("P1"))
                .isInstanceOf(StoreException.class)
                .hasCauseInstanceOf(SQLException.class);
            assertThat(failing.getAttempts()).isEqualTo(1);
        }
    }
}
