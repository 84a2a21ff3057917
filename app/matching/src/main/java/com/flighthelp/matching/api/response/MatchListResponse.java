/*
 * どこで: Matching API レスポンス DTO
 * 何を: 候補一覧 API の出力を定義する
 * なぜ: スコア順の候補をクライアントへ返すため
 */
package com.flighthelp.matching.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はレスポンス返却専用であり、防御的コピーを行わないため")
public record MatchListResponse(
    String domain, long requestId, List<RankedMatchResponse> matches) {}
