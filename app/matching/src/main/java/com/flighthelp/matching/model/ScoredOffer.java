/*
 * どこで: Matching ドメインモデル
 * 何を: 1 件の候補 offer とその適合スコアを表現する
 * なぜ: ランキング結果を API 応答へ渡すため
 */
package com.flighthelp.matching.model;

public record ScoredOffer<O extends HelpOffer>(
    O offer, double score, double reputation, String reason) {}
