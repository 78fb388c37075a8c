package com.stator;

import com.stator.internal.StatorRunner;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = { TestApplication.class, JpaStatorStoreIntegrationTest.GraphConfig.class },
        properties = "stator.runner.enabled=false")
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class JpaStatorStoreIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:17-alpine")
            .withDatabaseName("testdb")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void registerPgProperties(DynamicPropertyRegistry registry) {
        registry.add("testcontainers.postgresql.host", postgres::getHost);
        registry.add("testcontainers.postgresql.port", postgres::getFirstMappedPort);
        registry.add("testcontainers.postgresql.database", postgres::getDatabaseName);
        registry.add("testcontainers.postgresql.username", postgres::getUsername);
        registry.add("testcontainers.postgresql.password", postgres::getPassword);
    }

    @Configuration
    static class GraphConfig {
        @Bean
        StateGraph integrationPostGraph() {
            return StateGraph.builder("it_post")
                    .initialState("new")
                    .state("new", s -> s.tryInterval(Duration.ofSeconds(30))
                            .handler(context -> Optional.of("active"))
                            .transitionsTo("active"))
                    .state("active", s -> s.externallyProgressed().transitionsTo("done"))
                    .state("done")
                    .build();
        }
    }

    @Autowired
    StatorStore store;

    @Autowired
    StatorClient client;

    @Autowired
    StatorRunner runner;

    @Autowired
    JdbcTemplate jdbcTemplate;

    private static OffsetDateTime now() {
        return OffsetDateTime.now(ZoneOffset.UTC).truncatedTo(ChronoUnit.MILLIS);
    }

    @Test
    void shouldApplyBundledMigrations() {
        Integer applied = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM stator_schema_migrations", Integer.class);
        assertThat(applied).isEqualTo(2);
    }

    @Test
    void shouldReturnExistingRecordOnDuplicateCreate() {
        StatorRecord first = store.create("it_dup", "k-1", "new", now());
        StatorRecord second = store.create("it_dup", "k-1", "new", now());

        assertThat(second.getId()).isEqualTo(first.getId());
    }

    @Test
    void shouldGrantLeaseOnceUntilItExpires() {
        UUID id = store.create("it_lease", UUID.randomUUID().toString(), "new", now()).getId();
        OffsetDateTime now = now();
        OffsetDateTime expiry = now.plusSeconds(10);

        assertThat(store.tryAcquireLease(id, "runner-a", expiry, now)).isTrue();
        assertThat(store.tryAcquireLease(id, "runner-b", expiry, now)).isFalse();
        assertThat(store.tryAcquireLease(id, "runner-b", expiry.plusSeconds(10), expiry)).isFalse();
        assertThat(store.tryAcquireLease(id, "runner-b", expiry.plusSeconds(10), expiry.plusNanos(1_000_000)))
                .isTrue();
        assertThat(store.releaseLease(id, "runner-a", now)).isFalse();
        assertThat(store.releaseLease(id, "runner-b", now)).isTrue();
    }

    @Test
    void shouldRecordAttemptAndMarkReadyAfterCutoff() {
        UUID id = store.create("it_retry", UUID.randomUUID().toString(), "new", now()).getId();
        OffsetDateTime attemptedAt = now();
        store.tryAcquireLease(id, "runner-a", attemptedAt.plusMinutes(5), attemptedAt);

        assertThat(store.recordAttempt(id, "runner-a", attemptedAt)).isTrue();
        assertThat(store.releaseLease(id, "runner-a", attemptedAt)).isTrue();
        StatorRecord attempted = store.findById(id).orElseThrow();
        assertThat(attempted.isReady()).isFalse();
        assertThat(attempted.getAttemptCount()).isEqualTo(1);

        assertThat(store.bulkMarkReady("it_retry", "new", attemptedAt.minusSeconds(1), now())).isZero();
        assertThat(store.bulkMarkReady("it_retry", "new", attemptedAt, now())).isEqualTo(1);
        assertThat(store.findById(id).orElseThrow().isReady()).isTrue();
    }

    @Test
    void shouldFetchOnlyReadyUnleasedRecordsOldestFirst() {
        String type = "it_fetch";
        OffsetDateTime base = now().minusMinutes(10);
        UUID older = store.create(type, "a", "new", base).getId();
        UUID newer = store.create(type, "b", "new", base.plusMinutes(1)).getId();
        UUID leased = store.create(type, "c", "new", base.minusMinutes(1)).getId();
        store.create(type, "d", "done", base);
        store.tryAcquireLease(leased, "runner-a", now().plusMinutes(5), now());

        List<StatorRecord> batch = store.fetchReadyBatch(type, List.of("new"), 10, now());

        assertThat(batch).extracting(StatorRecord::getId).containsExactly(older, newer);
        assertThat(store.fetchReadyBatch(type, List.of("new"), 1, now())).hasSize(1);
    }

    @Test
    void shouldDriveRecordThroughGraphWithSingleCycle() {
        StatorRecord record = client.create("it_post", "post-1");

        assertThat(runner.runSingleCycle()).containsEntry("it_post", 1);

        StatorRecord active = store.findById(record.getId()).orElseThrow();
        assertThat(active.getState()).isEqualTo("active");
        assertThat(active.isReady()).isTrue();
        assertThat(active.getLeasedBy()).isNull();
        assertThat(active.getAttemptedAt()).isNull();

        assertThat(client.transition(record.getId(), "done").getState()).isEqualTo("done");
        assertThat(store.countReadyByType()).containsKey("it_post");
    }
}
