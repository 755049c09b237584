package com.yava.intent.registry;

import com.yava.intent.IntentFixtures;
import com.yava.intent.config.IntentClassifierProperties;
import com.yava.intent.model.IntentRecord;
import com.yava.intent.model.RegistrySnapshot;
import com.yava.intent.model.UpdateResult;
import com.yava.intent.model.ValidationReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntentRegistryTest {

    private IntentClassifierProperties properties;
    private IntentRegistry registry;

    @BeforeEach
    void setUp() {
        properties = IntentFixtures.properties();
        registry = IntentFixtures.registry(properties, IntentFixtures.pharmacy(), IntentFixtures.benefits());
    }

    @Nested
    @DisplayName("initialize")
    class Initialize {

        @Test
        void publishesVersionOne() {
            RegistrySnapshot snapshot = registry.current();

            assertThat(snapshot.getVersion()).isEqualTo(1L);
            assertThat(snapshot.getRecords()).extracting(IntentRecord::getIntentId)
                .containsExactly("INT-BEN-0014", "INT-PHR-0001");
        }

        @Test
        void currentFailsBeforeInitialization() {
            IntentRegistry empty = new IntentRegistry(IntentFixtures.setValidator(properties), properties);

            assertThat(empty.isInitialized()).isFalse();
            assertThatThrownBy(empty::current).isInstanceOf(IllegalStateException.class);
        }

        @Test
        void invalidConfigurationIsNotPublished() {
            IntentRegistry empty = new IntentRegistry(IntentFixtures.setValidator(properties), properties);

            ValidationReport report = empty.initialize(List.of(IntentFixtures.pharmacy().toBuilder().priority(0).build()));

            assertThat(report.isValid()).isFalse();
            assertThat(empty.isInitialized()).isFalse();
        }

        @Test
        void secondInitializationFails() {
            assertThatThrownBy(() -> registry.initialize(List.of(IntentFixtures.claims())))
                .isInstanceOf(IllegalStateException.class);
            assertThat(registry.current().getVersion()).isEqualTo(1L);
        }
    }

    @Nested
    @DisplayName("single-record merge")
    class ApplyMerge {

        @Test
        void validMergeIncrementsVersion() {
            UpdateResult result = registry.applyMerge(IntentFixtures.claims());

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getReason()).isEqualTo(UpdateResult.Reason.PUBLISHED);
            assertThat(result.getVersion()).isEqualTo(2L);
            assertThat(registry.current().find("INT-CLM-0035")).isPresent();
        }

        @Test
        @DisplayName("an invalid merge leaves the active snapshot untouched")
        void invalidMergeKeepsVersion() {
            RegistrySnapshot before = registry.current();

            UpdateResult result = registry.applyMerge(IntentFixtures.claims().toBuilder().confidenceThreshold(1.5).build());

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getReason()).isEqualTo(UpdateResult.Reason.INVALID);
            assertThat(result.getVersion()).isEqualTo(1L);
            assertThat(result.getReport().hasErrorFor("INT-CLM-0035")).isTrue();
            assertThat(registry.current()).isSameAs(before);
        }

        @Test
        @DisplayName("re-submitting an existing record publishes a new version with the same content")
        void resubmitIsIdempotentInContent() {
            registry.applyMerge(IntentFixtures.pharmacy());

            RegistrySnapshot after = registry.current();
            assertThat(after.getVersion()).isEqualTo(2L);
            assertThat(after.getRecords()).containsExactly(IntentFixtures.benefits(), IntentFixtures.pharmacy());
        }

        @Test
        void updateReplacesRecordInPlace() {
            registry.applyMerge(IntentFixtures.pharmacy().toBuilder().agentRouting("RxAgent").build());

            assertThat(registry.current().size()).isEqualTo(2);
            assertThat(registry.current().find("INT-PHR-0001"))
                .get().extracting(IntentRecord::getAgentRouting).isEqualTo("RxAgent");
        }

        @Test
        @DisplayName("older snapshots held by readers are not affected by a publish")
        void readersKeepTheirSnapshot() {
            RegistrySnapshot held = registry.current();

            registry.applyMerge(IntentFixtures.claims());

            assertThat(held.getVersion()).isEqualTo(1L);
            assertThat(held.find("INT-CLM-0035")).isEmpty();
        }
    }

    @Nested
    @DisplayName("stage and activate")
    class StageAndActivate {

        @Test
        void activatePublishesStagedSet() {
            ValidationReport report = registry.stage(List.of(IntentFixtures.claims()));
            UpdateResult result = registry.activateStaged();

            assertThat(report.isValid()).isTrue();
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getVersion()).isEqualTo(2L);
            assertThat(registry.current().getRecords()).containsExactly(IntentFixtures.claims());
            assertThat(registry.staged()).isEmpty();
        }

        @Test
        void stagingDoesNotChangeActiveSnapshot() {
            registry.stage(List.of(IntentFixtures.claims()));

            assertThat(registry.current().getVersion()).isEqualTo(1L);
            assertThat(registry.staged()).get()
                .extracting(StagedConfiguration::getBaseVersion).isEqualTo(1L);
        }

        @Test
        void activateWithNothingStaged() {
            UpdateResult result = registry.activateStaged();

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getReason()).isEqualTo(UpdateResult.Reason.NOTHING_STAGED);
            assertThat(result.getVersion()).isEqualTo(1L);
        }

        @Test
        @DisplayName("an invalid upload discards the previously staged set")
        void invalidStageClearsSlot() {
            registry.stage(List.of(IntentFixtures.claims()));

            ValidationReport report = registry.stage(List.of());

            assertThat(report.isValid()).isFalse();
            assertThat(registry.staged()).isEmpty();
            assertThat(registry.activateStaged().getReason()).isEqualTo(UpdateResult.Reason.NOTHING_STAGED);
        }

        @Test
        @DisplayName("a staged set is stale once another update was published")
        void staleStagedSet() {
            registry.stage(List.of(IntentFixtures.claims()));
            registry.applyMerge(IntentFixtures.pharmacy().toBuilder().agentRouting("RxAgent").build());

            UpdateResult result = registry.activateStaged();

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getReason()).isEqualTo(UpdateResult.Reason.STALE);
            assertThat(result.getVersion()).isEqualTo(2L);
            assertThat(registry.current().find("INT-CLM-0035")).isEmpty();
            assertThat(registry.staged()).isEmpty();
        }
    }

    @Test
    @DisplayName("concurrent merges each publish exactly one version")
    void concurrentMerges() throws Exception {
        properties.getRegistry().setMaxPublishAttempts(50);
        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        Set<Long> observedVersions = ConcurrentHashMap.newKeySet();
        try {
            List<Future<UpdateResult>> futures = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                IntentRecord record = IntentFixtures.minimal(String.format("INT-WEL-%04d", i + 1), "program " + i).build();
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int r = 0; r < 50; r++) {
                        observedVersions.add(registry.current().getVersion());
                    }
                    return registry.applyMerge(record);
                }));
            }
            start.countDown();

            List<Long> versions = new ArrayList<>();
            for (Future<UpdateResult> future : futures) {
                UpdateResult result = future.get(10, TimeUnit.SECONDS);
                assertThat(result.isSuccess()).isTrue();
                versions.add(result.getVersion());
            }

            assertThat(versions).doesNotHaveDuplicates();
            assertThat(registry.current().getVersion()).isEqualTo(1L + writers);
            assertThat(registry.current().size()).isEqualTo(2 + writers);
            assertThat(observedVersions).allMatch(v -> v >= 1L && v <= 1L + writers);
        } finally {
            pool.shutdownNow();
        }
    }
}
