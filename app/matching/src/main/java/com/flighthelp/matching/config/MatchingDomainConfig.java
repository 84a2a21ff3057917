/*
 * どこで: Matching 設定
 * 何を: 2 系統の照合ルールと Repository を MatchingDomains へ登録する
 * なぜ: domain の追加を 1 箇所の配線で済ませるため
 */
package com.flighthelp.matching.config;

import com.flighthelp.matching.repository.FlightCompanionRepository;
import com.flighthelp.matching.repository.PickupRepository;
import com.flighthelp.matching.scoring.FlightCompanionMatchingPolicy;
import com.flighthelp.matching.scoring.PickupMatchingPolicy;
import com.flighthelp.matching.service.DomainBinding;
import com.flighthelp.matching.service.MatchingDomains;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MatchingDomainConfig {

  @Bean
  public MatchingDomains matchingDomains(
      FlightCompanionMatchingPolicy flightCompanionPolicy,
      FlightCompanionRepository flightCompanionRepository,
      PickupMatchingPolicy pickupPolicy,
      PickupRepository pickupRepository) {
    return new MatchingDomains(
        List.of(
            new DomainBinding<>(flightCompanionPolicy, flightCompanionRepository),
            new DomainBinding<>(pickupPolicy, pickupRepository)));
  }
}
