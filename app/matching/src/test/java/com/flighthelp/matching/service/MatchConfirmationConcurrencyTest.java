/*
 * どこで: Matching テスト
 * 何を: 同じ offer への並行確定を Postgres 上で競合させる
 * なぜ: 同行は 1 件だけ、送迎は残席の範囲でしか成立しないことを実 DB のロックで確認するため
 */
package com.flighthelp.matching.service;

import static com.flighthelp.matching.MatchingFixtures.NZ289;
import static com.flighthelp.matching.MatchingFixtures.flightOffer;
import static com.flighthelp.matching.MatchingFixtures.flightRequest;
import static com.flighthelp.matching.MatchingFixtures.pickupOffer;
import static com.flighthelp.matching.MatchingFixtures.pickupRequest;
import static org.assertj.core.api.Assertions.assertThat;

import com.flighthelp.matching.AbstractPostgresContainerTest;
import com.flighthelp.matching.model.FlightCompanionOffer;
import com.flighthelp.matching.model.MatchOutcome;
import com.flighthelp.matching.model.OutcomeStatus;
import com.flighthelp.matching.model.PickupOffer;
import com.flighthelp.matching.model.ServiceDomain;
import com.flighthelp.matching.repository.FlightCompanionRepository;
import com.flighthelp.matching.repository.PickupRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class MatchConfirmationConcurrencyTest extends AbstractPostgresContainerTest {

  private static final int CONTENDERS = 6;

  @Autowired private MatchConfirmationService confirmationService;

  @Autowired private FlightCompanionRepository flightRepository;

  @Autowired private PickupRepository pickupRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    final MapSqlParameterSource none = new MapSqlParameterSource();
    jdbcTemplate.update("DELETE FROM match_audit", none);
    jdbcTemplate.update("DELETE FROM flight_companion_requests", none);
    jdbcTemplate.update("DELETE FROM flight_companion_offers", none);
    jdbcTemplate.update("DELETE FROM pickup_requests", none);
    jdbcTemplate.update("DELETE FROM pickup_offers", none);
  }

  @Test
  void onlyOneRequestWinsFlightCompanionOffer() throws Exception {
    final FlightCompanionOffer offer =
        flightRepository.insertOffer(flightOffer(0L, "helper-1", NZ289, "80"));
    final List<Long> requestIds = new ArrayList<>();
    for (int i = 0; i < CONTENDERS; i++) {
      requestIds.add(
          flightRepository.insertRequest(flightRequest(0L, "user-" + i, NZ289, "100")).id());
    }

    final List<OutcomeStatus> results =
        race(
            requestIds,
            requestId ->
                confirmationService.confirm(ServiceDomain.FLIGHT_COMPANION, requestId, offer.id()));

    assertThat(results).filteredOn(OutcomeStatus.OK::equals).hasSize(1);
    assertThat(results).filteredOn(OutcomeStatus.CONFLICT::equals).hasSize(CONTENDERS - 1);
    final Integer matchedRows =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM flight_companion_requests WHERE matched_offer_id = :offerId",
            new MapSqlParameterSource().addValue("offerId", offer.id()),
            Integer.class);
    assertThat(matchedRows).isEqualTo(1);
  }

  @Test
  void pickupSeatsAreNeverOverbooked() throws Exception {
    final PickupOffer offer = pickupRepository.insertOffer(pickupOffer(0L, "helper-1", 5, 5, true));
    final List<Long> requestIds = new ArrayList<>();
    for (int i = 0; i < CONTENDERS; i++) {
      requestIds.add(pickupRepository.insertRequest(pickupRequest(0L, "user-" + i, 2, true)).id());
    }

    final List<OutcomeStatus> results =
        race(
            requestIds,
            requestId -> confirmationService.confirm(ServiceDomain.PICKUP, requestId, offer.id()));

    assertThat(results).filteredOn(OutcomeStatus.OK::equals).hasSize(2);
    final PickupOffer stored = pickupRepository.findOfferById(offer.id()).orElseThrow();
    assertThat(stored.remainingSeats()).isEqualTo(1);
    assertThat(stored.available()).isTrue();
  }

  private List<OutcomeStatus> race(List<Long> requestIds, Confirm confirm) throws Exception {
    final ExecutorService executor = Executors.newFixedThreadPool(requestIds.size());
    final CountDownLatch start = new CountDownLatch(1);
    try {
      final List<Future<MatchOutcome<?>>> futures = new ArrayList<>();
      for (Long requestId : requestIds) {
        final Callable<MatchOutcome<?>> task =
            () -> {
              start.await();
              return confirm.apply(requestId);
            };
        futures.add(executor.submit(task));
      }
      start.countDown();
      final List<OutcomeStatus> results = new ArrayList<>();
      for (Future<MatchOutcome<?>> future : futures) {
        results.add(future.get(30, TimeUnit.SECONDS).status());
      }
      return results;
    } finally {
      executor.shutdownNow();
    }
  }

  @FunctionalInterface
  private interface Confirm {
    MatchOutcome<?> apply(long requestId);
  }
}
