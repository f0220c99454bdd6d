package com.stockalert.monitor.infrastructure.db.alert;

import static org.assertj.core.api.Assertions.assertThat;

import com.stockalert.common.event.Direction;
import com.stockalert.monitor.infrastructure.db.settings.OwnerSettingsEntity;
import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Testcontainers(disabledWithoutDocker = true)
class AlertJpaRepositoryTest {

    private static final Long OWNER_ID = 42L;
    private static final Instant CHECKED_AT = Instant.parse("2024-06-03T14:00:00Z");

    @Container
    static final PostgreSQLContainer<?> postgres =
            new PostgreSQLContainer<>(DockerImageName.parse("postgres:17-alpine"))
                    .withDatabaseName("stock_alert_test")
                    .withUsername("test")
                    .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private AlertJpaRepository alertJpaRepository;

    @Autowired
    private TestEntityManager entityManager;

    @Test
    void shouldRecordNewerCheck() {
        // given
        var alert = persistAlert(OWNER_ID, true);
        alertJpaRepository.recordCheck(alert.getId(), new BigDecimal("101.50"), CHECKED_AT);

        // when
        var updated = alertJpaRepository.recordCheck(alert.getId(), new BigDecimal("102.00"), CHECKED_AT.plusSeconds(60));
        entityManager.clear();

        // then
        assertThat(updated).isEqualTo(1);
        var reloaded = alertJpaRepository.findById(alert.getId()).orElseThrow();
        assertThat(reloaded.getLastPrice()).isEqualByComparingTo("102.00");
        assertThat(reloaded.getLastCheckedAt()).isEqualTo(CHECKED_AT.plusSeconds(60));
    }

    @Test
    void shouldNotMoveLastCheckedBackwards() {
        // given
        var alert = persistAlert(OWNER_ID, true);
        alertJpaRepository.recordCheck(alert.getId(), new BigDecimal("101.50"), CHECKED_AT);

        // when
        var updated = alertJpaRepository.recordCheck(alert.getId(), new BigDecimal("90.00"), CHECKED_AT.minusSeconds(30));
        entityManager.clear();

        // then
        assertThat(updated).isZero();
        var reloaded = alertJpaRepository.findById(alert.getId()).orElseThrow();
        assertThat(reloaded.getLastPrice()).isEqualByComparingTo("101.50");
        assertThat(reloaded.getLastCheckedAt()).isEqualTo(CHECKED_AT);
    }

    @Test
    void shouldDeactivateOnlyOnce() {
        // given
        var alert = persistAlert(OWNER_ID, true);

        // when
        var first = alertJpaRepository.deactivateIfActive(alert.getId());
        var second = alertJpaRepository.deactivateIfActive(alert.getId());
        entityManager.clear();

        // then
        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        assertThat(alertJpaRepository.findById(alert.getId()).orElseThrow().isActive()).isFalse();
    }

    @Test
    void shouldRetargetAndReactivateOwnAlert() {
        // given
        var alert = persistAlert(OWNER_ID, false);
        alertJpaRepository.recordCheck(alert.getId(), new BigDecimal("101.50"), CHECKED_AT);

        // when
        var updated = alertJpaRepository.retarget(
                alert.getId(), OWNER_ID, new BigDecimal("90.00"), Direction.BELOW, new BigDecimal("101.50"));
        entityManager.clear();

        // then
        assertThat(updated).isEqualTo(1);
        var reloaded = alertJpaRepository.findById(alert.getId()).orElseThrow();
        assertThat(reloaded.isActive()).isTrue();
        assertThat(reloaded.getDirection()).isEqualTo(Direction.BELOW);
        assertThat(reloaded.getTargetPrice()).isEqualByComparingTo("90.00");
        assertThat(reloaded.getLastCheckedAt()).isNull();
    }

    @Test
    void shouldNotRetargetAnotherOwnersAlert() {
        // given
        var alert = persistAlert(OWNER_ID, true);

        // when
        var updated = alertJpaRepository.retarget(
                alert.getId(), 7L, new BigDecimal("90.00"), Direction.BELOW, new BigDecimal("101.50"));
        entityManager.clear();

        // then
        assertThat(updated).isZero();
        var reloaded = alertJpaRepository.findById(alert.getId()).orElseThrow();
        assertThat(reloaded.getTargetPrice()).isEqualByComparingTo("100.00");
        assertThat(reloaded.getDirection()).isEqualTo(Direction.ABOVE);
    }

    @Test
    void shouldJoinOwnerSettingsAndLeaveMissingIntervalsNull() {
        // given
        var withSettings = persistAlert(OWNER_ID, true);
        var withoutSettings = persistAlert(7L, true);
        persistAlert(OWNER_ID, false);
        entityManager.persist(OwnerSettingsEntity.builder()
                .ownerId(OWNER_ID)
                .domesticIntervalSeconds(30)
                .updatedAt(CHECKED_AT)
                .build());
        entityManager.flush();
        entityManager.clear();

        // when
        var rows = alertJpaRepository.findActiveWithOwnerSettings();

        // then
        assertThat(rows).extracting(row -> row.alert().getId())
                .containsExactly(withSettings.getId(), withoutSettings.getId());
        assertThat(rows.get(0).domesticIntervalSeconds()).isEqualTo(30);
        assertThat(rows.get(0).foreignIntervalSeconds()).isNull();
        assertThat(rows.get(1).domesticIntervalSeconds()).isNull();
        assertThat(rows.get(1).foreignIntervalSeconds()).isNull();
    }

    private AlertEntity persistAlert(Long ownerId, boolean active) {
        var alert = entityManager.persistAndFlush(AlertEntity.builder()
                .ownerId(ownerId)
                .ticker("AAPL")
                .exchange("NASDAQ")
                .companyName("Apple Inc.")
                .targetPrice(new BigDecimal("100.00"))
                .currency("USD")
                .direction(Direction.ABOVE)
                .lastPrice(new BigDecimal("95.00"))
                .active(active)
                .createdAt(CHECKED_AT)
                .build());
        entityManager.clear();
        return alert;
    }
}
