/*
 * どこで: Matching API
 * 何を: エラー応答の標準フォーマットを定義する
 * なぜ: 例外ハンドリング時のレスポンス形状を統一するため
 */
package com.flighthelp.matching.api;

public record ApiErrorResponse(ApiErrorCode code, String message) {}
