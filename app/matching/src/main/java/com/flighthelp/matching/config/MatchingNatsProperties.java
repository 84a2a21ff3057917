/*
 * どこで: Matching 設定
 * 何を: マッチ成立イベントの publish 先 subject を保持する
 * なぜ: 通知側の購読 subject と運用で揃えるため
 */
package com.flighthelp.matching.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "matching.nats")
public record MatchingNatsProperties(@NotBlank String subject) {}
