package com.localcooks.booking.domain.aggregate;

import com.localcooks.booking.domain.model.DecisionOutcome;
import com.localcooks.booking.domain.model.KitchenBooking;
import com.localcooks.booking.domain.model.StorageBooking;
import com.localcooks.booking.domain.repository.KitchenBookingRepository;
import com.localcooks.booking.domain.repository.StorageBookingRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration test for {@link JpaBookingAggregateRepository} against a real PostgreSQL instance:
 * the decision claim and the all-or-nothing status commit.
 *
 * Test-managed transactions are off so every repository call commits on its own, as it does in production.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(JpaBookingAggregateRepository.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Testcontainers(disabledWithoutDocker = true)
class JpaBookingAggregateRepositoryIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("booking_db")
            .withUsername("postgres")
            .withPassword("postgres");

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create");
    }

    @Autowired
    private JpaBookingAggregateRepository aggregateRepository;

    @Autowired
    private KitchenBookingRepository kitchenBookingRepository;

    @Autowired
    private StorageBookingRepository storageBookingRepository;

    @AfterEach
    void cleanUp() {
        storageBookingRepository.deleteAll();
        kitchenBookingRepository.deleteAll();
    }

    private KitchenBooking saveKitchenBooking(boolean claimed, LocalDateTime claimedAt) {
        return kitchenBookingRepository.saveAndFlush(KitchenBooking.builder()
                .chefId(100L)
                .managerId(5L)
                .kitchenId(3L)
                .locationTimezone("America/St_Johns")
                .bookingDate(LocalDate.of(2026, 2, 2))
                .startTime("09:00")
                .endTime("13:00")
                .totalPriceCents(10_000L)
                .status(KitchenBooking.BookingStatus.PENDING)
                .paymentAuthorizationRef("pi_kitchen")
                .decisionInProgress(claimed)
                .decisionStartedAt(claimedAt)
                .build());
    }

    private StorageBooking saveStorage(Long kitchenBookingId, String name, StorageBooking.StorageStatus status) {
        return storageBookingRepository.saveAndFlush(StorageBooking.builder()
                .kitchenBookingId(kitchenBookingId)
                .storageListingId(11L)
                .name(name)
                .storageType(StorageBooking.StorageType.COLD)
                .totalPriceCents(2_500L)
                .startDate(LocalDate.of(2026, 2, 2))
                .endDate(LocalDate.of(2026, 2, 9))
                .status(status)
                .build());
    }

    @Test
    @DisplayName("claimForDecision admits one decision at a time until the claim is released")
    void claimForDecision_isExclusiveUntilReleased() {
        // given
        Long bookingId = saveKitchenBooking(false, null).getId();

        // when / then
        Optional<String> first = aggregateRepository.claimForDecision(bookingId);
        assertThat(first).isPresent();
        assertThat(aggregateRepository.claimForDecision(bookingId)).isEmpty();

        aggregateRepository.releaseClaim(bookingId, first.get());
        assertThat(aggregateRepository.claimForDecision(bookingId)).isPresent();
    }

    @Test
    @DisplayName("a claim older than the timeout can be taken over")
    void claimForDecision_staleClaimIsReclaimable() {
        // given: a claim left behind by a crashed request an hour ago
        Long bookingId = saveKitchenBooking(true, LocalDateTime.now().minusHours(1)).getId();

        // when / then
        assertThat(aggregateRepository.claimForDecision(bookingId)).isPresent();
    }

    @Test
    @DisplayName("a request whose stale claim was taken over cannot release its successor's claim")
    void releaseClaim_afterTakeoverKeepsSuccessorClaim() {
        // given: request A claims, stalls past the timeout, and request B takes over
        Long bookingId = saveKitchenBooking(false, null).getId();
        String claimA = aggregateRepository.claimForDecision(bookingId).orElseThrow();
        KitchenBooking stalled = kitchenBookingRepository.findById(bookingId).orElseThrow();
        stalled.setDecisionStartedAt(LocalDateTime.now().minusHours(1));
        kitchenBookingRepository.saveAndFlush(stalled);
        String claimB = aggregateRepository.claimForDecision(bookingId).orElseThrow();

        // when: A finishes late and releases
        aggregateRepository.releaseClaim(bookingId, claimA);

        // then: B still holds the gate, so a third request is refused
        assertThat(claimB).isNotEqualTo(claimA);
        assertThat(aggregateRepository.claimForDecision(bookingId)).isEmpty();
        KitchenBooking reloaded = kitchenBookingRepository.findById(bookingId).orElseThrow();
        assertThat(reloaded.isDecisionInProgress()).isTrue();
        assertThat(reloaded.getDecisionClaimToken()).isEqualTo(claimB);

        aggregateRepository.releaseClaim(bookingId, claimB);
        assertThat(aggregateRepository.claimForDecision(bookingId)).isPresent();
    }

    @Test
    @DisplayName("claimForDecision refuses a booking that does not exist")
    void claimForDecision_unknownBooking() {
        assertThat(aggregateRepository.claimForDecision(987_654L)).isEmpty();
    }

    @Test
    @DisplayName("persistDecisions writes nothing when one storage row is no longer pending")
    void persistDecisions_rollsBackAsAWhole() {
        // given
        Long bookingId = saveKitchenBooking(false, null).getId();
        StorageBooking pending = saveStorage(bookingId, "Walk-in cooler", StorageBooking.StorageStatus.PENDING);
        StorageBooking decided = saveStorage(bookingId, "Dry shelf", StorageBooking.StorageStatus.CONFIRMED);

        Map<Long, DecisionOutcome> storageOutcomes = new LinkedHashMap<>();
        storageOutcomes.put(pending.getId(), DecisionOutcome.CONFIRMED);
        storageOutcomes.put(decided.getId(), DecisionOutcome.CANCELLED);

        // when
        assertThatThrownBy(() -> aggregateRepository.persistDecisions(
                bookingId, DecisionOutcome.CONFIRMED, storageOutcomes))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("no longer pending");

        // then
        assertThat(kitchenBookingRepository.findById(bookingId).orElseThrow().getStatus())
                .isEqualTo(KitchenBooking.BookingStatus.PENDING);
        assertThat(storageBookingRepository.findById(pending.getId()).orElseThrow().getStatus())
                .isEqualTo(StorageBooking.StorageStatus.PENDING);
        assertThat(storageBookingRepository.findById(decided.getId()).orElseThrow().getStatus())
                .isEqualTo(StorageBooking.StorageStatus.CONFIRMED);
    }

    @Test
    @DisplayName("persistDecisions applies kitchen and storage outcomes together")
    void persistDecisions_appliesAll() {
        // given
        Long bookingId = saveKitchenBooking(false, null).getId();
        StorageBooking storage = saveStorage(bookingId, "Walk-in cooler", StorageBooking.StorageStatus.PENDING);

        // when
        aggregateRepository.persistDecisions(bookingId, DecisionOutcome.CONFIRMED,
                Map.of(storage.getId(), DecisionOutcome.CANCELLED));

        // then
        BookingAggregate reloaded = aggregateRepository.loadForApproval(bookingId).orElseThrow();
        assertThat(reloaded.status()).isEqualTo(KitchenBooking.BookingStatus.CONFIRMED);
        assertThat(storageBookingRepository.findById(storage.getId()).orElseThrow().getStatus())
                .isEqualTo(StorageBooking.StorageStatus.CANCELLED);
    }

    @Test
    @DisplayName("persistDecisions refuses a storage booking of another kitchen booking")
    void persistDecisions_foreignStorageRow() {
        // given
        Long bookingId = saveKitchenBooking(false, null).getId();
        Long otherBookingId = saveKitchenBooking(false, null).getId();
        StorageBooking foreign = saveStorage(otherBookingId, "Freezer", StorageBooking.StorageStatus.PENDING);

        // when / then
        assertThatThrownBy(() -> aggregateRepository.persistDecisions(
                bookingId, null, Map.of(foreign.getId(), DecisionOutcome.CONFIRMED)))
                .isInstanceOf(IllegalStateException.class);
        assertThat(storageBookingRepository.findById(foreign.getId()).orElseThrow().getStatus())
                .isEqualTo(StorageBooking.StorageStatus.PENDING);
    }
}
