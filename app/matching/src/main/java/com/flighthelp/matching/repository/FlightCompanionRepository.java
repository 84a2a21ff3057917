/*
 * どこで: Matching データアクセス
 * 何を: flight_companion_requests/offers の登録/参照/状態遷移を行う
 * なぜ: 1 便 1 依頼の排他を条件付き UPDATE で保証するため
 */
package com.flighthelp.matching.repository;

import static com.flighthelp.common.JdbcTimestampUtils.toInstant;
import static com.flighthelp.common.JdbcTimestampUtils.toLocalDate;
import static com.flighthelp.common.JdbcTimestampUtils.toSqlDate;
import static com.flighthelp.common.JdbcTimestampUtils.toTimestamp;

import com.flighthelp.matching.model.FlightCompanionOffer;
import com.flighthelp.matching.model.FlightCompanionRequest;
import com.flighthelp.matching.model.FlightItinerary;
import com.flighthelp.matching.model.MatchAuditRecord;
import com.flighthelp.matching.model.ServiceDomain;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class FlightCompanionRepository
    implements HelpMatchRepository<FlightCompanionRequest, FlightCompanionOffer> {

  private static final String REQUEST_COLUMNS =
      """
      id, requester_id, flight_number, flight_date, departure_airport, arrival_airport,
      airline, traveler_name, traveler_age, special_needs, offered_amount, additional_notes,
      is_active, is_matched, matched_offer_id, matched_at, version, created_at
      """;

  private static final String OFFER_COLUMNS =
      """
      id, helper_id, flight_number, flight_date, departure_airport, arrival_airport,
      airline, available_services, languages, requested_amount, is_available, additional_info,
      helped_count, average_rating, version, created_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final MatchAuditRepository auditRepository;

  @Override
  public ServiceDomain domain() {
    return ServiceDomain.FLIGHT_COMPANION;
  }

  public FlightCompanionRequest insertRequest(FlightCompanionRequest draft) {
    final FlightItinerary itinerary = draft.itinerary().normalized();
    final String sql =
        """
        INSERT INTO flight_companion_requests (
          requester_id, flight_number, flight_date, departure_airport, arrival_airport,
          airline, traveler_name, traveler_age, special_needs, offered_amount, additional_notes,
          is_active, is_matched, version, created_at
        ) VALUES (
          :requesterId, :flightNumber, :flightDate, :departureAirport, :arrivalAirport,
          :airline, :travelerName, :travelerAge, :specialNeeds, :offeredAmount, :additionalNotes,
          TRUE, FALSE, 0, :createdAt
        )
        RETURNING
        """
            + REQUEST_COLUMNS;
    final MapSqlParameterSource params =
        itineraryParams(itinerary)
            .addValue("requesterId", draft.requesterId())
            .addValue("airline", draft.airline())
            .addValue("travelerName", draft.travelerName())
            .addValue("travelerAge", draft.travelerAge())
            .addValue("specialNeeds", draft.specialNeeds())
            .addValue("offeredAmount", draft.offeredAmount())
            .addValue("additionalNotes", draft.additionalNotes())
            .addValue("createdAt", toTimestamp(draft.createdAt()));
    return jdbcTemplate.queryForObject(sql, params, this::mapRequest);
  }

  public FlightCompanionOffer insertOffer(FlightCompanionOffer draft) {
    final FlightItinerary itinerary = draft.itinerary().normalized();
    final String sql =
        """
        INSERT INTO flight_companion_offers (
          helper_id, flight_number, flight_date, departure_airport, arrival_airport,
          airline, available_services, languages, requested_amount, is_available, additional_info,
          helped_count, average_rating, version, created_at
        ) VALUES (
          :helperId, :flightNumber, :flightDate, :departureAirport, :arrivalAirport,
          :airline, :availableServices, :languages, :requestedAmount, TRUE, :additionalInfo,
          :helpedCount, :averageRating, 0, :createdAt
        )
        RETURNING
        """
            + OFFER_COLUMNS;
    final MapSqlParameterSource params =
        itineraryParams(itinerary)
            .addValue("helperId", draft.helperId())
            .addValue("airline", draft.airline())
            .addValue("availableServices", draft.availableServices())
            .addValue("languages", draft.languages())
            .addValue("requestedAmount", draft.requestedAmount())
            .addValue("additionalInfo", draft.additionalInfo())
            .addValue("helpedCount", draft.helpedCount())
            .addValue("averageRating", draft.averageRating())
            .addValue("createdAt", toTimestamp(draft.createdAt()));
    return jdbcTemplate.queryForObject(sql, params, this::mapOffer);
  }

  @Override
  public Optional<FlightCompanionRequest> findRequestById(long requestId) {
    final String sql =
        "SELECT " + REQUEST_COLUMNS + " FROM flight_companion_requests WHERE id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", requestId);
    return jdbcTemplate.query(sql, params, this::mapRequest).stream().findFirst();
  }

  @Override
  public Optional<FlightCompanionOffer> findOfferById(long offerId) {
    final String sql = "SELECT " + OFFER_COLUMNS + " FROM flight_companion_offers WHERE id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", offerId);
    return jdbcTemplate.query(sql, params, this::mapOffer).stream().findFirst();
  }

  @Override
  public List<FlightCompanionOffer> findAvailableOffersFor(FlightCompanionRequest request) {
    // 旅程キーは登録時に正規化済みなので等値比較でインデックスを使える
    final String sql =
        "SELECT "
            + OFFER_COLUMNS
            + """
            FROM flight_companion_offers
            WHERE flight_number = :flightNumber
              AND flight_date = :flightDate
              AND departure_airport = :departureAirport
              AND arrival_airport = :arrivalAirport
              AND is_available
              AND helper_id <> :requesterId
            ORDER BY created_at, id
            """;
    final MapSqlParameterSource params =
        itineraryParams(request.itinerary().normalized())
            .addValue("requesterId", request.requesterId());
    return jdbcTemplate.query(sql, params, this::mapOffer);
  }

  @Override
  @Transactional
  public void bindMatch(
      FlightCompanionRequest request, FlightCompanionOffer offer, Instant matchedAt) {
    final String requestSql =
        """
        UPDATE flight_companion_requests
        SET is_matched = TRUE,
            matched_offer_id = :offerId,
            matched_at = :matchedAt,
            version = version + 1
        WHERE id = :requestId
          AND version = :expectedVersion
          AND is_active
          AND NOT is_matched
        """;
    final MapSqlParameterSource requestParams =
        new MapSqlParameterSource()
            .addValue("requestId", request.id())
            .addValue("offerId", offer.id())
            .addValue("matchedAt", toTimestamp(matchedAt))
            .addValue("expectedVersion", request.version());
    final int requestUpdated;
    try {
      requestUpdated = jdbcTemplate.update(requestSql, requestParams);
    } catch (DuplicateKeyException e) {
      // 別の request が同じ offer を先に確定した
      throw new StaleMatchStateException("offer already bound: offerId=" + offer.id(), e);
    }
    if (requestUpdated == 0) {
      throw new StaleMatchStateException("request state changed: requestId=" + request.id());
    }

    final String offerSql =
        """
        UPDATE flight_companion_offers
        SET is_available = FALSE,
            version = version + 1
        WHERE id = :offerId
          AND is_available
        """;
    final int offerUpdated =
        jdbcTemplate.update(offerSql, new MapSqlParameterSource().addValue("offerId", offer.id()));
    if (offerUpdated == 0) {
      throw new StaleMatchStateException("offer no longer available: offerId=" + offer.id());
    }
    auditRepository.insert(
        new MatchAuditRecord(
            UUID.randomUUID(),
            domain(),
            request.id(),
            offer.id(),
            MatchAuditRecord.ACTION_CONFIRMED,
            request.requesterId(),
            matchedAt));
  }

  @Override
  @Transactional
  public void releaseMatch(
      FlightCompanionRequest request,
      FlightCompanionOffer offer,
      String actorId,
      Instant releasedAt) {
    final String requestSql =
        """
        UPDATE flight_companion_requests
        SET is_matched = FALSE,
            matched_offer_id = NULL,
            matched_at = NULL,
            version = version + 1
        WHERE id = :requestId
          AND version = :expectedVersion
          AND is_matched
          AND matched_offer_id = :offerId
        """;
    final MapSqlParameterSource requestParams =
        new MapSqlParameterSource()
            .addValue("requestId", request.id())
            .addValue("offerId", offer.id())
            .addValue("expectedVersion", request.version());
    if (jdbcTemplate.update(requestSql, requestParams) == 0) {
      throw new StaleMatchStateException("request state changed: requestId=" + request.id());
    }
    final String offerSql =
        """
        UPDATE flight_companion_offers
        SET is_available = TRUE,
            version = version + 1
        WHERE id = :offerId
        """;
    jdbcTemplate.update(offerSql, new MapSqlParameterSource().addValue("offerId", offer.id()));
    auditRepository.insert(
        new MatchAuditRecord(
            UUID.randomUUID(),
            domain(),
            request.id(),
            offer.id(),
            MatchAuditRecord.ACTION_CANCELLED,
            actorId,
            releasedAt));
  }

  @Override
  public boolean deactivateRequest(long requestId) {
    final String sql =
        """
        UPDATE flight_companion_requests
        SET is_active = FALSE,
            version = version + 1
        WHERE id = :requestId
          AND is_active
          AND NOT is_matched
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("requestId", requestId))
        > 0;
  }

  @Override
  public int deactivateRequestsBefore(LocalDate date) {
    final String sql =
        """
        UPDATE flight_companion_requests
        SET is_active = FALSE,
            version = version + 1
        WHERE flight_date < :date
          AND is_active
          AND NOT is_matched
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("date", toSqlDate(date)));
  }

  private MapSqlParameterSource itineraryParams(FlightItinerary itinerary) {
    return new MapSqlParameterSource()
        .addValue("flightNumber", itinerary.flightNumber())
        .addValue("flightDate", toSqlDate(itinerary.flightDate()))
        .addValue("departureAirport", itinerary.departureAirport())
        .addValue("arrivalAirport", itinerary.arrivalAirport());
  }

  private FlightItinerary mapItinerary(ResultSet rs) throws SQLException {
    return new FlightItinerary(
        rs.getString("flight_number"),
        toLocalDate(rs.getDate("flight_date")),
        rs.getString("departure_airport"),
        rs.getString("arrival_airport"));
  }

  private FlightCompanionRequest mapRequest(ResultSet rs, int rowNum) throws SQLException {
    return new FlightCompanionRequest(
        rs.getLong("id"),
        rs.getString("requester_id"),
        mapItinerary(rs),
        rs.getString("airline"),
        rs.getString("traveler_name"),
        rs.getString("traveler_age"),
        rs.getString("special_needs"),
        rs.getBigDecimal("offered_amount"),
        rs.getString("additional_notes"),
        rs.getBoolean("is_active"),
        rs.getBoolean("is_matched"),
        rs.getObject("matched_offer_id", Long.class),
        toInstant(rs.getTimestamp("matched_at")),
        rs.getLong("version"),
        toInstant(rs.getTimestamp("created_at")));
  }

  private FlightCompanionOffer mapOffer(ResultSet rs, int rowNum) throws SQLException {
    return new FlightCompanionOffer(
        rs.getLong("id"),
        rs.getString("helper_id"),
        mapItinerary(rs),
        rs.getString("airline"),
        rs.getString("available_services"),
        rs.getString("languages"),
        rs.getBigDecimal("requested_amount"),
        rs.getBoolean("is_available"),
        rs.getString("additional_info"),
        rs.getInt("helped_count"),
        rs.getBigDecimal("average_rating"),
        rs.getLong("version"),
        toInstant(rs.getTimestamp("created_at")));
  }
}
