/*
 * どこで: Matching API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.flighthelp.matching.api;

public enum ApiErrorCode {
  MATCHING_BAD_REQUEST,
  MATCHING_FORBIDDEN,
  MATCHING_NOT_FOUND,
  MATCHING_CONFLICT,
  MATCHING_STORE_UNAVAILABLE,
  MATCHING_INTERNAL_ERROR
}
