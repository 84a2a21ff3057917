/*
 * どこで: Matching データアクセス
 * 何を: pickup_requests/offers の登録/参照/状態遷移を行う
 * なぜ: 残席の減算と request の確定を同一トランザクションで行い、過剰割当を防ぐため
 */
package com.flighthelp.matching.repository;

import static com.flighthelp.common.JdbcTimestampUtils.toInstant;
import static com.flighthelp.common.JdbcTimestampUtils.toLocalDate;
import static com.flighthelp.common.JdbcTimestampUtils.toLocalTime;
import static com.flighthelp.common.JdbcTimestampUtils.toSqlDate;
import static com.flighthelp.common.JdbcTimestampUtils.toSqlTime;
import static com.flighthelp.common.JdbcTimestampUtils.toTimestamp;

import com.flighthelp.matching.model.MatchAuditRecord;
import com.flighthelp.matching.model.PickupItinerary;
import com.flighthelp.matching.model.PickupOffer;
import com.flighthelp.matching.model.PickupRequest;
import com.flighthelp.matching.model.ServiceDomain;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class PickupRepository implements HelpMatchRepository<PickupRequest, PickupOffer> {

  private static final String REQUEST_COLUMNS =
      """
      id, requester_id, airport, arrival_date, arrival_time, flight_number, destination_address,
      passenger_name, passenger_phone, passenger_count, has_luggage, offered_amount,
      special_requests, is_active, is_matched, matched_offer_id, matched_at, version, created_at
      """;

  private static final String OFFER_COLUMNS =
      """
      id, helper_id, airport, available_date, available_time, vehicle_type, max_passengers,
      remaining_seats, can_handle_luggage, service_area, base_rate, languages,
      additional_services, is_available, total_pickups, average_rating, version, created_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final MatchAuditRepository auditRepository;

  @Override
  public ServiceDomain domain() {
    return ServiceDomain.PICKUP;
  }

  public PickupRequest insertRequest(PickupRequest draft) {
    final String sql =
        """
        INSERT INTO pickup_requests (
          requester_id, airport, arrival_date, arrival_time, flight_number, destination_address,
          passenger_name, passenger_phone, passenger_count, has_luggage, offered_amount,
          special_requests, is_active, is_matched, version, created_at
        ) VALUES (
          :requesterId, :airport, :arrivalDate, :arrivalTime, :flightNumber, :destinationAddress,
          :passengerName, :passengerPhone, :passengerCount, :hasLuggage, :offeredAmount,
          :specialRequests, TRUE, FALSE, 0, :createdAt
        )
        RETURNING
        """
            + REQUEST_COLUMNS;
    final PickupItinerary itinerary = draft.itinerary();
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("requesterId", draft.requesterId())
            .addValue("airport", itinerary.normalizedAirport())
            .addValue("arrivalDate", toSqlDate(itinerary.date()))
            .addValue("arrivalTime", toSqlTime(itinerary.time()))
            .addValue("flightNumber", draft.flightNumber())
            .addValue("destinationAddress", draft.destinationAddress())
            .addValue("passengerName", draft.passengerName())
            .addValue("passengerPhone", draft.passengerPhone())
            .addValue("passengerCount", draft.passengerCount())
            .addValue("hasLuggage", draft.hasLuggage())
            .addValue("offeredAmount", draft.offeredAmount())
            .addValue("specialRequests", draft.specialRequests())
            .addValue("createdAt", toTimestamp(draft.createdAt()));
    return jdbcTemplate.queryForObject(sql, params, this::mapRequest);
  }

  public PickupOffer insertOffer(PickupOffer draft) {
    final String sql =
        """
        INSERT INTO pickup_offers (
          helper_id, airport, available_date, available_time, vehicle_type, max_passengers,
          remaining_seats, can_handle_luggage, service_area, base_rate, languages,
          additional_services, is_available, total_pickups, average_rating, version, created_at
        ) VALUES (
          :helperId, :airport, :availableDate, :availableTime, :vehicleType, :maxPassengers,
          :maxPassengers, :canHandleLuggage, :serviceArea, :baseRate, :languages,
          :additionalServices, TRUE, :totalPickups, :averageRating, 0, :createdAt
        )
        RETURNING
        """
            + OFFER_COLUMNS;
    final PickupItinerary itinerary = draft.itinerary();
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("helperId", draft.helperId())
            .addValue("airport", itinerary.normalizedAirport())
            .addValue("availableDate", toSqlDate(itinerary.date()))
            .addValue("availableTime", toSqlTime(itinerary.time()))
            .addValue("vehicleType", draft.vehicleType())
            .addValue("maxPassengers", draft.maxPassengers())
            .addValue("canHandleLuggage", draft.canHandleLuggage())
            .addValue("serviceArea", draft.serviceArea())
            .addValue("baseRate", draft.baseRate())
            .addValue("languages", draft.languages())
            .addValue("additionalServices", draft.additionalServices())
            .addValue("totalPickups", draft.totalPickups())
            .addValue("averageRating", draft.averageRating())
            .addValue("createdAt", toTimestamp(draft.createdAt()));
    return jdbcTemplate.queryForObject(sql, params, this::mapOffer);
  }

  @Override
  public Optional<PickupRequest> findRequestById(long requestId) {
    final String sql = "SELECT " + REQUEST_COLUMNS + " FROM pickup_requests WHERE id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", requestId);
    return jdbcTemplate.query(sql, params, this::mapRequest).stream().findFirst();
  }

  @Override
  public Optional<PickupOffer> findOfferById(long offerId) {
    final String sql = "SELECT " + OFFER_COLUMNS + " FROM pickup_offers WHERE id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", offerId);
    return jdbcTemplate.query(sql, params, this::mapOffer).stream().findFirst();
  }

  @Override
  public List<PickupOffer> findAvailableOffersFor(PickupRequest request) {
    // 時刻の許容幅は policy 側で判定するため、空港と日付のみで絞る
    final String sql =
        "SELECT "
            + OFFER_COLUMNS
            + """
            FROM pickup_offers
            WHERE airport = :airport
              AND available_date = :date
              AND is_available
              AND helper_id <> :requesterId
            ORDER BY created_at, id
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("airport", request.itinerary().normalizedAirport())
            .addValue("date", toSqlDate(request.itinerary().date()))
            .addValue("requesterId", request.requesterId());
    return jdbcTemplate.query(sql, params, this::mapOffer);
  }

  @Override
  @Transactional
  public void bindMatch(PickupRequest request, PickupOffer offer, Instant matchedAt) {
    final String requestSql =
        """
        UPDATE pickup_requests
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
    if (jdbcTemplate.update(requestSql, requestParams) == 0) {
      throw new StaleMatchStateException("request state changed: requestId=" + request.id());
    }

    // SET 句の右辺は更新前の値を参照する
    final String offerSql =
        """
        UPDATE pickup_offers
        SET remaining_seats = remaining_seats - :seats,
            is_available = (remaining_seats - :seats) > 0,
            version = version + 1
        WHERE id = :offerId
          AND is_available
          AND remaining_seats >= :seats
        """;
    final MapSqlParameterSource offerParams =
        new MapSqlParameterSource()
            .addValue("offerId", offer.id())
            .addValue("seats", request.passengerCount());
    if (jdbcTemplate.update(offerSql, offerParams) == 0) {
      throw new StaleMatchStateException("offer has no remaining seats: offerId=" + offer.id());
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
      PickupRequest request, PickupOffer offer, String actorId, Instant releasedAt) {
    final String requestSql =
        """
        UPDATE pickup_requests
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
        UPDATE pickup_offers
        SET remaining_seats = LEAST(max_passengers, remaining_seats + :seats),
            is_available = TRUE,
            version = version + 1
        WHERE id = :offerId
        """;
    final MapSqlParameterSource offerParams =
        new MapSqlParameterSource()
            .addValue("offerId", offer.id())
            .addValue("seats", request.passengerCount());
    jdbcTemplate.update(offerSql, offerParams);
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
        UPDATE pickup_requests
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
        UPDATE pickup_requests
        SET is_active = FALSE,
            version = version + 1
        WHERE arrival_date < :date
          AND is_active
          AND NOT is_matched
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("date", toSqlDate(date)));
  }

  private PickupRequest mapRequest(ResultSet rs, int rowNum) throws SQLException {
    return new PickupRequest(
        rs.getLong("id"),
        rs.getString("requester_id"),
        new PickupItinerary(
            rs.getString("airport"),
            toLocalDate(rs.getDate("arrival_date")),
            toLocalTime(rs.getTime("arrival_time"))),
        rs.getString("flight_number"),
        rs.getString("destination_address"),
        rs.getString("passenger_name"),
        rs.getString("passenger_phone"),
        rs.getInt("passenger_count"),
        rs.getBoolean("has_luggage"),
        rs.getBigDecimal("offered_amount"),
        rs.getString("special_requests"),
        rs.getBoolean("is_active"),
        rs.getBoolean("is_matched"),
        rs.getObject("matched_offer_id", Long.class),
        toInstant(rs.getTimestamp("matched_at")),
        rs.getLong("version"),
        toInstant(rs.getTimestamp("created_at")));
  }

  private PickupOffer mapOffer(ResultSet rs, int rowNum) throws SQLException {
    return new PickupOffer(
        rs.getLong("id"),
        rs.getString("helper_id"),
        new PickupItinerary(
            rs.getString("airport"),
            toLocalDate(rs.getDate("available_date")),
            toLocalTime(rs.getTime("available_time"))),
        rs.getString("vehicle_type"),
        rs.getInt("max_passengers"),
        rs.getInt("remaining_seats"),
        rs.getBoolean("can_handle_luggage"),
        rs.getString("service_area"),
        rs.getBigDecimal("base_rate"),
        rs.getString("languages"),
        rs.getString("additional_services"),
        rs.getBoolean("is_available"),
        rs.getInt("total_pickups"),
        rs.getBigDecimal("average_rating"),
        rs.getLong("version"),
        toInstant(rs.getTimestamp("created_at")));
  }
}
