/*
 * どこで: Matching ドメインモデル
 * 何を: マッチング操作の結果区分を定義する
 * なぜ: 呼び出し側が「再試行すべきか」「この組合せが無効か」を区別できるようにするため
 */
package com.flighthelp.matching.model;

public enum OutcomeStatus {
  OK,
  NOT_FOUND,
  CONFLICT,
  INVALID,
  FORBIDDEN
}
