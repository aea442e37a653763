package com.upsearch.sync;

import com.upsearch.PropertyDatabase;
import com.upsearch.loader.BatchLoader;
import com.upsearch.loader.LoadFailedException;
import com.upsearch.model.PropertyRecord;
import com.upsearch.search.PropertySearchService;
import com.upsearch.search.SearchIndex;
import com.upsearch.source.ArchiveEmptyException;
import com.upsearch.source.ArchiveReader;
import com.upsearch.source.FetchFailedException;
import com.upsearch.normalize.RecordNormalizer;
import com.upsearch.support.MapSourceFetcher;
import com.upsearch.support.TestArchives;
import com.upsearch.support.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SyncOrchestratorTest {

    @TempDir
    Path tempDir;

    private PropertyDatabase database;
    private MapSourceFetcher fetcher;

    @BeforeEach
    void setUp() {
        database = TestDatabase.open(tempDir);
        fetcher = new MapSourceFetcher();
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    private PropertySearchService service(int batchSize) {
        BatchLoader loader = database.createBatchLoader(batchSize, null);
        return database.createSearchService(database.createOrchestrator(fetcher, loader));
    }

    @Nested
    class EndToEndTests {

        @Test
        void shouldKeepFirstWriteAndIndexIt() {
            // Given - two rows sharing one id
            fetcher.put("00_All_Records.zip", TestArchives.propertyTable(
                new String[] {"P1", "Smith", "FRESNO", "12.50", "ACME BANK"},
                new String[] {"P1", "Jones", "FRESNO", "99", "ACME BANK"}));
            PropertySearchService service = service(10);

            // When
            SyncSummary summary = service.triggerIngestion(List.of("00_All_Records.zip"));

            // Then
            assertThat(summary.getInserted()).isEqualTo(1);
            assertThat(summary.getSkipped()).isEqualTo(1);
            assertThat(summary.getProcessed()).isEqualTo(2);
            assertThat(service.getById("P1").getOwnerName()).isEqualTo("Smith");
            assertThat(service.getById("P1").getAmountReported()).isEqualByComparingTo("12.50");
            assertThat(service.search("Smith", 5)).extracting(PropertyRecord::getPropertyId).containsExactly("P1");
            assertThat(service.search("Jones", 5)).isEmpty();
        }

        @Test
        void shouldCountDroppedRows() {
            fetcher.put("a.zip", TestArchives.propertyTable(
                new String[] {"P1", "Smith", "FRESNO", "1", "BANK"},
                new String[] {"", "Nobody", "FRESNO", "1", "BANK"}));

            SyncSummary summary = service(10).triggerIngestion(List.of("a.zip"));

            assertThat(summary.getInserted()).isEqualTo(1);
            assertThat(summary.getDropped()).isEqualTo(1);
            assertThat(summary.getProcessed()).isEqualTo(2);
        }

        @Test
        void shouldLoadRowsAroundMalformedLine() {
            // Given - the middle row has a stray quote inside the owner name
            fetcher.put("a.zip", TestArchives.zip("t.csv",
                "PROPERTY_ID,OWNER_NAME,AMOUNT_REPORTED\nP1,SMITH,1.00\nP2,\"O\"BRIEN,2.00\nP3,JONES,3.00\n"));

            // When
            SyncSummary summary = service(10).triggerIngestion(List.of("a.zip"));

            // Then
            assertThat(summary.getInserted()).isEqualTo(3);
            assertThat(database.getStore().count()).isEqualTo(3);
            assertThat(database.createReadOnlySearchService().search("obrien", 5)).extracting(PropertyRecord::getPropertyId).containsExactly("P2");
        }

        @Test
        void shouldBeIdempotentOnRepeatedRuns() {
            fetcher.put("00_All_Records.zip", TestArchives.generatedTable("P", 25));
            PropertySearchService service = service(10);
            service.triggerIngestion(List.of("00_All_Records.zip"));

            // When
            SyncSummary second = service.triggerIngestion(List.of("00_All_Records.zip"));

            // Then
            assertThat(second.getInserted()).isZero();
            assertThat(second.getSkipped()).isEqualTo(25);
            assertThat(database.getStore().count()).isEqualTo(25);
            assertThat(TestDatabase.indexRowCount(database)).isEqualTo(25);
        }

        @Test
        void shouldAddOnlyNewRecordsFromSupersetSource() {
            fetcher.put("00_All_Records.zip", TestArchives.generatedTable("P", 10));
            fetcher.put("04_From_500_To_Beyond.zip", TestArchives.generatedTable("P", 15));

            SyncSummary summary = service(4).triggerIngestion(List.of("00_All_Records.zip", "04_From_500_To_Beyond.zip"));

            assertThat(summary.getInserted()).isEqualTo(15);
            assertThat(summary.getSkipped()).isEqualTo(10);
            assertThat(summary.getLocations()).extracting(m -> m.getInserted()).containsExactly(10L, 5L);
            assertThat(database.getSearchIndex().lag()).isZero();
        }

        @Test
        void shouldServeReadsWhileIngesting() {
            fetcher.put("a.zip", TestArchives.generatedTable("P", 9));
            PropertySearchService reader = database.createReadOnlySearchService();
            List<Integer> seen = new ArrayList<>();
            BatchLoader loader = database.createBatchLoader(3,
                (location, result, metrics) -> seen.add(reader.search("sacramento", 100).size()));

            database.createOrchestrator(fetcher, loader).run(List.of("a.zip"));

            assertThat(seen).containsExactly(3, 6, 9);
        }
    }

    @Nested
    class FailureTests {

        @Test
        void shouldReportFetchFailureWithEarlierProgress() {
            fetcher.put("a.zip", TestArchives.generatedTable("P", 5));
            PropertySearchService service = service(2);

            assertThatThrownBy(() -> service.triggerIngestion(List.of("a.zip", "missing.zip")))
                .isInstanceOfSatisfying(SyncFailedException.class, e -> {
                    assertThat(e.getLocation()).isEqualTo("missing.zip");
                    assertThat(e.getCause()).isInstanceOf(FetchFailedException.class);
                    assertThat(e.getCommittedSoFar().getInserted()).isEqualTo(5);
                });
            assertThat(database.getStore().count()).isEqualTo(5);
        }

        @Test
        void shouldReportEmptyArchive() {
            fetcher.put("empty.zip", TestArchives.emptyZip());

            assertThatThrownBy(() -> service(2).triggerIngestion(List.of("empty.zip")))
                .isInstanceOf(SyncFailedException.class)
                .hasCauseInstanceOf(ArchiveEmptyException.class);
        }

        @Test
        void shouldNotFetchLaterLocationsAfterFailure() {
            fetcher.put("b.zip", TestArchives.generatedTable("P", 1));

            assertThatThrownBy(() -> service(2).triggerIngestion(List.of("missing.zip", "b.zip")))
                .isInstanceOf(SyncFailedException.class);
            assertThat(fetcher.getFetched()).containsExactly("missing.zip");
        }

        @Test
        void shouldHealIndexOnNextRunAfterCrash() {
            // Given - the index step fails once, after the first chunk reached the store
            fetcher.put("a.zip", TestArchives.generatedTable("P", 6));
            SearchIndex flaky = new SearchIndex(database.getDataSource(), database.getStore()) {
                private boolean failed;

                @Override
                public int extend(Connection conn) throws SQLException {
                    if (!failed) {
                        failed = true;
                        throw new SQLException("simulated crash");
                    }
                    return super.extend(conn);
                }
            };
            BatchLoader crashing = new BatchLoader(database.getDataSource(), database.getStore(), flaky, 4);
            SyncOrchestrator first = new SyncOrchestrator(fetcher, new ArchiveReader(), new RecordNormalizer(),
                crashing, database.getSearchIndex());

            assertThatThrownBy(() -> first.run(List.of("a.zip")))
                .isInstanceOfSatisfying(SyncFailedException.class, e -> {
                    assertThat(e.getCause()).isInstanceOf(LoadFailedException.class);
                    assertThat(e.getCommittedSoFar().getInserted()).isEqualTo(4);
                });
            assertThat(database.getSearchIndex().lag()).isEqualTo(4);

            // When
            SyncSummary rerun = service(4).triggerIngestion(List.of("a.zip"));

            // Then
            assertThat(rerun.getHealed()).isEqualTo(4);
            assertThat(rerun.getInserted()).isEqualTo(2);
            assertThat(rerun.getSkipped()).isEqualTo(4);
            assertThat(database.getStore().count()).isEqualTo(6);
            assertThat(TestDatabase.indexRowCount(database)).isEqualTo(6);
        }
    }

    @Nested
    class ConcurrencyTests {

        @Test
        void shouldRejectSecondConcurrentRun() throws Exception {
            // Given - a run parked inside its first fetch
            CountDownLatch fetching = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            fetcher.put("a.zip", TestArchives.generatedTable("P", 3));
            MapSourceFetcher blocking = new MapSourceFetcher() {
                @Override
                public byte[] fetch(String location) {
                    fetching.countDown();
                    try {
                        release.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return fetcher.fetch(location);
                }
            };
            SyncOrchestrator orchestrator = database.createOrchestrator(blocking, database.createBatchLoader(10, null));
            CompletableFuture<SyncSummary> running = CompletableFuture.supplyAsync(() -> orchestrator.run(List.of("a.zip")));
            assertThat(fetching.await(10, TimeUnit.SECONDS)).isTrue();

            // When/Then
            assertThat(orchestrator.isRunning()).isTrue();
            assertThatThrownBy(() -> orchestrator.run(List.of("a.zip")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already in progress");

            release.countDown();
            assertThat(running.get(10, TimeUnit.SECONDS).getInserted()).isEqualTo(3);
            assertThat(orchestrator.isRunning()).isFalse();
        }
    }
}
