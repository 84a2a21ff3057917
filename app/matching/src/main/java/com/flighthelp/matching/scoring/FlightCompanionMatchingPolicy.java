/*
 * どこで: Matching スコアリング層
 * 何を: 同行系統の照合ルールを提供する
 * なぜ: 同一便の照合と、特別な配慮事項に対する対応可否をスコアへ反映するため
 */
package com.flighthelp.matching.scoring;

import com.flighthelp.matching.model.FlightCompanionOffer;
import com.flighthelp.matching.model.FlightCompanionRequest;
import com.flighthelp.matching.model.ServiceDomain;
import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class FlightCompanionMatchingPolicy
    implements MatchingPolicy<FlightCompanionRequest, FlightCompanionOffer> {

  private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[,;/]");

  @Override
  public ServiceDomain domain() {
    return ServiceDomain.FLIGHT_COMPANION;
  }

  @Override
  public boolean isItineraryCompatible(
      FlightCompanionRequest request, FlightCompanionOffer offer) {
    return request.itinerary().sameFlightAs(offer.itinerary());
  }

  @Override
  public Optional<String> intrinsicViolation(
      FlightCompanionRequest request, FlightCompanionOffer offer) {
    return Optional.empty();
  }

  @Override
  public boolean hasCapacityFor(FlightCompanionRequest request, FlightCompanionOffer offer) {
    return offer.available();
  }

  /**
   * 役割: request の配慮事項/年齢区分のうち、offer のサービス/言語で対応できる割合を返す。
   * 動作: 区切り文字で分割したトークンを大文字小文字を無視した部分一致で照合する。
   * 前提: 配慮事項が一つも無ければ 1.0 とする。
   */
  @Override
  public OptionalDouble capabilityFit(FlightCompanionRequest request, FlightCompanionOffer offer) {
    final List<String> needs = new ArrayList<>(tokens(request.specialNeeds()));
    needs.addAll(tokens(request.travelerAge()));
    if (needs.isEmpty()) {
      return OptionalDouble.of(1.0);
    }
    final List<String> skills = new ArrayList<>(tokens(offer.availableServices()));
    skills.addAll(tokens(offer.languages()));
    long satisfied = needs.stream().filter(need -> isCovered(need, skills)).count();
    return OptionalDouble.of((double) satisfied / needs.size());
  }

  @Override
  public String recommendationReason(FlightCompanionOffer offer) {
    return Reasons.describe(offer, "trips helped", "Available for your flight");
  }

  private static boolean isCovered(String need, List<String> skills) {
    for (String skill : skills) {
      if (skill.contains(need) || need.contains(skill)) {
        return true;
      }
    }
    return false;
  }

  @VisibleForTesting
  static List<String> tokens(String value) {
    final List<String> tokens = new ArrayList<>();
    if (value == null || value.isBlank()) {
      return tokens;
    }
    for (String raw : TOKEN_SEPARATOR.split(value)) {
      final String token = raw.trim().toLowerCase(Locale.ROOT);
      if (!token.isEmpty()) {
        tokens.add(token);
      }
    }
    return tokens;
  }
}
