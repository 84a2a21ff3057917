/*
 * どこで: Common 共通設定
 * 何を: 業務タイムゾーン付きの Clock を DI 可能にする
 * なぜ: 便の日付切れ判定と監査時刻を同じ時計で扱うため
 */
package com.flighthelp.common.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock(@Value("${time.zone:UTC}") String zone) {
    return Clock.system(ZoneId.of(zone));
  }
}
