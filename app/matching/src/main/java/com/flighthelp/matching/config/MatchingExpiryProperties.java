/*
 * どこで: Matching 設定
 * 何を: 日付切れ request の自動無効化スケジュールを保持する
 * なぜ: 実行間隔と有効/無効を運用で調整できるようにするため
 */
package com.flighthelp.matching.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "matching.expiry")
public record MatchingExpiryProperties(boolean enabled, Duration interval) {}
