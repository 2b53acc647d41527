package com.equipment.analytics.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.equipment.analytics.exception.DatasetNotFoundException;
import com.equipment.analytics.exception.DatasetStorageException;
import com.equipment.analytics.model.Dataset;
import com.equipment.analytics.model.DatasetDraft;
import com.equipment.analytics.model.DatasetListing;
import com.equipment.analytics.model.EquipmentRecord;
import com.equipment.analytics.model.EquipmentType;
import com.equipment.analytics.repository.DatasetRepository;
import com.equipment.analytics.repository.H2Databases;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RetentionManagerTest {

    private DatasetRepository repository;
    private Clock clock;

    @BeforeEach
    void setUp() {
        repository = new DatasetRepository(H2Databases.fresh(), new ObjectMapper());
        clock = new TickingClock(Instant.parse("2024-05-01T08:00:00Z"));
    }

    @Test
    void keepsOnlyTheNewestDatasets() {
        RetentionManager manager = new RetentionManager(repository, clock, 5);

        for (int i = 1; i <= 7; i++) {
            manager.ingest("alice", draft("ds" + i));
        }

        assertThat(manager.list("alice")).extracting(DatasetListing::name)
                .containsExactly("ds7", "ds6", "ds5", "ds4", "ds3");
        assertThat(manager.findAll("alice")).extracting(Dataset::getName)
                .containsExactly("ds7", "ds6", "ds5", "ds4", "ds3");
    }

    @Test
    void ingestAssignsIdAndTimestamp() {
        RetentionManager manager = new RetentionManager(repository, clock, 5);

        Dataset saved = manager.ingest("alice", draft("ds"));

        assertThat(saved.getId()).isNotNull();
        assertThat(saved.getUploadedAt()).isEqualTo(Instant.parse("2024-05-01T08:00:01Z"));
        assertThat(manager.find("alice", saved.getId()).getRecords()).isEqualTo(saved.getRecords());
    }

    @Test
    void ownersAreIndependent() {
        RetentionManager manager = new RetentionManager(repository, clock, 2);

        manager.ingest("alice", draft("a1"));
        manager.ingest("bob", draft("b1"));
        manager.ingest("alice", draft("a2"));
        manager.ingest("alice", draft("a3"));

        assertThat(manager.list("alice")).extracting(DatasetListing::name).containsExactly("a3", "a2");
        assertThat(manager.list("bob")).extracting(DatasetListing::name).containsExactly("b1");
    }

    @Test
    void foreignAndUnknownDatasetsAreNotFound() {
        RetentionManager manager = new RetentionManager(repository, clock, 5);
        long id = manager.ingest("alice", draft("a1")).getId();

        assertThatThrownBy(() -> manager.find("bob", id)).isInstanceOf(DatasetNotFoundException.class);
        assertThatThrownBy(() -> manager.delete("bob", id)).isInstanceOf(DatasetNotFoundException.class);
        assertThatThrownBy(() -> manager.delete("alice", id + 1)).isInstanceOf(DatasetNotFoundException.class);
        manager.ingest("bob", draft("b1"));
        assertThatThrownBy(() -> manager.delete("bob", id)).isInstanceOf(DatasetNotFoundException.class);

        assertThat(manager.list("alice")).hasSize(1);
    }

    @Test
    void deletingTheLastDatasetLeavesAnEmptyList() {
        RetentionManager manager = new RetentionManager(repository, clock, 5);
        long id = manager.ingest("alice", draft("only")).getId();

        manager.delete("alice", id);

        assertThat(manager.list("alice")).isEmpty();
        assertThat(manager.findAll("alice")).isEmpty();
        assertThat(manager.list("never-uploaded")).isEmpty();
    }

    @Test
    void failedIngestRollsBackEverything() {
        RetentionManager manager = new RetentionManager(repository, clock, 1);
        manager.ingest("alice", draft("kept"));

        DatasetDraft tooLong = draft("x".repeat(300));

        assertThatThrownBy(() -> manager.ingest("alice", tooLong)).isInstanceOf(DatasetStorageException.class);
        assertThat(manager.list("alice")).extracting(DatasetListing::name).containsExactly("kept");
    }

    @Test
    void storesLongEquipmentNamesAndFileNames() {
        RetentionManager manager = new RetentionManager(repository, clock, 5);
        String equipmentName = "pump-".repeat(100);
        String filename = "plant-".repeat(80) + ".csv";
        DatasetDraft draft = DatasetDraft.builder()
                .name("long names")
                .sourceFilename(filename)
                .record(new EquipmentRecord(equipmentName, EquipmentType.PUMP, 10, 2, 80))
                .build();

        Dataset saved = manager.ingest("alice", draft);

        Dataset loaded = manager.find("alice", saved.getId());
        assertThat(loaded.getSourceFilename()).isEqualTo(filename);
        assertThat(loaded.getRecords()).extracting(EquipmentRecord::name).containsExactly(equipmentName);
    }

    @Test
    void reconcileAppliesLoweredLimit() {
        RetentionManager generous = new RetentionManager(repository, clock, 5);
        for (int i = 1; i <= 5; i++) {
            generous.ingest("alice", draft("ds" + i));
        }
        generous.ingest("bob", draft("b1"));

        RetentionManager strict = new RetentionManager(repository, clock, 2);

        assertThat(strict.findOwnersOverLimit()).containsExactly("alice");
        assertThat(strict.reconcile("alice")).isEqualTo(3);
        assertThat(strict.reconcile("alice")).isZero();
        assertThat(strict.reconcile("nobody")).isZero();
        assertThat(strict.list("alice")).extracting(DatasetListing::name).containsExactly("ds5", "ds4");
        assertThat(strict.findOwnersOverLimit()).isEmpty();
    }

    @Test
    void rejectsNonPositiveLimit() {
        assertThatThrownBy(() -> new RetentionManager(repository, clock, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void concurrentIngestsNeverExceedTheLimit() throws Exception {
        RetentionManager manager = new RetentionManager(repository, clock, 3);
        manager.ingest("alice", draft("seed"));

        int writers = 6;
        int perWriter = 5;
        ExecutorService pool = Executors.newFixedThreadPool(writers + 1);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean writing = new AtomicBoolean(true);
        AtomicInteger maxObserved = new AtomicInteger();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                int writer = w;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perWriter; i++) {
                        manager.ingest("alice", draft("w" + writer + "-" + i));
                    }
                    return null;
                }));
            }
            Future<?> reader = pool.submit(() -> {
                start.await();
                while (writing.get()) {
                    maxObserved.accumulateAndGet(manager.list("alice").size(), Math::max);
                    maxObserved.accumulateAndGet(manager.findAll("alice").size(), Math::max);
                }
                return null;
            });

            start.countDown();
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
            writing.set(false);
            reader.get(60, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(manager.list("alice")).hasSize(3);
        assertThat(maxObserved.get()).isLessThanOrEqualTo(3);
    }

    private static DatasetDraft draft(String name) {
        return DatasetDraft.builder()
                .name(name)
                .sourceFilename(name + ".csv")
                .record(new EquipmentRecord(name + "-P", EquipmentType.PUMP, 10, 2, 80))
                .record(new EquipmentRecord(name + "-V", EquipmentType.VALVE, 4, 1, 20))
                .build();
    }

    /**
     * Advances one second on every read so each ingest gets a distinct, increasing timestamp.
     */
    private static final class TickingClock extends Clock {

        private final AtomicLong seconds;

        TickingClock(Instant start) {
            this.seconds = new AtomicLong(start.getEpochSecond());
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochSecond(seconds.incrementAndGet());
        }
    }
}
