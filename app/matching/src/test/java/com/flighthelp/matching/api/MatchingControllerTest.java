package com.flighthelp.matching.api;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flighthelp.matching.model.MatchConfirmation;
import com.flighthelp.matching.model.MatchOutcome;
import com.flighthelp.matching.model.RankedMatch;
import com.flighthelp.matching.model.ServiceDomain;
import com.flighthelp.matching.service.MatchConfirmationService;
import com.flighthelp.matching.service.MatchFinderService;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(MatchingController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class MatchingControllerTest {

  private static final Instant MATCHED_AT = Instant.parse("2026-03-02T10:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private MatchFinderService matchFinderService;
  @MockitoBean private MatchConfirmationService matchConfirmationService;

  @Test
  void findMatchesReturnsRankedList() throws Exception {
    when(matchFinderService.findMatches(ServiceDomain.FLIGHT_COMPANION, 7L, 3))
        .thenReturn(
            MatchOutcome.ok(
                List.of(
                    new RankedMatch(11L, "helper-1", 0.91, new BigDecimal("80"), "4.8 star rating"),
                    new RankedMatch(
                        12L, "helper-2", 0.72, new BigDecimal("120"), "Available for your flight"))));

    mockMvc
        .perform(get("/v1/flight-companion/requests/7/matches").param("max_results", "3"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.domain").value("flight-companion"))
        .andExpect(jsonPath("$.request_id").value(7))
        .andExpect(jsonPath("$.matches[0].offer_id").value(11))
        .andExpect(jsonPath("$.matches[0].reason").value("4.8 star rating"))
        .andExpect(jsonPath("$.matches[1].helper_id").value("helper-2"));
  }

  @Test
  void findMatchesUsesDefaultMaxResults() throws Exception {
    when(matchFinderService.findMatches(ServiceDomain.PICKUP, 5L, 10))
        .thenReturn(MatchOutcome.ok(List.of()));

    mockMvc
        .perform(get("/v1/pickup/requests/5/matches"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.matches").isEmpty());
  }

  @Test
  void findMatchesReturns404WhenRequestMissing() throws Exception {
    when(matchFinderService.findMatches(eq(ServiceDomain.PICKUP), anyLong(), anyInt()))
        .thenReturn(MatchOutcome.notFound("request not found: 99"));

    mockMvc
        .perform(get("/v1/pickup/requests/99/matches"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("MATCHING_NOT_FOUND"));
  }

  @Test
  void unknownDomainReturns400() throws Exception {
    mockMvc
        .perform(get("/v1/boat/requests/1/matches"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("MATCHING_BAD_REQUEST"));

    verifyNoInteractions(matchFinderService);
  }

  @Test
  void confirmMatchReturnsMatchedStatus() throws Exception {
    when(matchConfirmationService.confirm(ServiceDomain.FLIGHT_COMPANION, 7L, 11L))
        .thenReturn(
            MatchOutcome.ok(
                new MatchConfirmation(
                    ServiceDomain.FLIGHT_COMPANION, 7L, 11L, "user-a", "helper-1", MATCHED_AT)));

    mockMvc
        .perform(
            put("/v1/flight-companion/matches")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"request_id":7,"offer_id":11}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("MATCHED"))
        .andExpect(jsonPath("$.helper_id").value("helper-1"))
        .andExpect(jsonPath("$.matched_at").value("2026-03-02T10:00:00Z"));
  }

  @Test
  void confirmMatchReturns409WhenOfferTaken() throws Exception {
    when(matchConfirmationService.confirm(ServiceDomain.FLIGHT_COMPANION, 7L, 11L))
        .thenReturn(MatchOutcome.conflict("offer is no longer available"));

    mockMvc
        .perform(
            put("/v1/flight-companion/matches")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"request_id":7,"offer_id":11}
                    """))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("MATCHING_CONFLICT"))
        .andExpect(jsonPath("$.message").value("offer is no longer available"));
  }

  @Test
  void confirmMatchReturns400WhenOfferIdMissing() throws Exception {
    mockMvc
        .perform(
            put("/v1/pickup/matches")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"request_id":7}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("MATCHING_BAD_REQUEST"));

    verifyNoInteractions(matchConfirmationService);
  }

  @Test
  void confirmMatchReturns503WhenStoreUnavailable() throws Exception {
    when(matchConfirmationService.confirm(ServiceDomain.PICKUP, 7L, 11L))
        .thenThrow(new QueryTimeoutException("timeout"));

    mockMvc
        .perform(
            put("/v1/pickup/matches")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"request_id":7,"offer_id":11}
                    """))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("MATCHING_STORE_UNAVAILABLE"));
  }

  @Test
  void cancelMatchReturnsCancelledStatus() throws Exception {
    when(matchConfirmationService.cancel(ServiceDomain.PICKUP, 7L, "user-a"))
        .thenReturn(
            MatchOutcome.ok(
                new MatchConfirmation(
                    ServiceDomain.PICKUP, 7L, 11L, "user-a", "helper-1", MATCHED_AT)));

    mockMvc
        .perform(delete("/v1/pickup/requests/7/match").header("X-User-Id", "user-a"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("CANCELLED"))
        .andExpect(jsonPath("$.offer_id").value(11));
  }

  @Test
  void cancelMatchReturns403ForOtherUser() throws Exception {
    when(matchConfirmationService.cancel(ServiceDomain.PICKUP, 7L, "user-b"))
        .thenReturn(MatchOutcome.forbidden("only the requester can cancel a match"));

    mockMvc
        .perform(delete("/v1/pickup/requests/7/match").header("X-User-Id", "user-b"))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.code").value("MATCHING_FORBIDDEN"));
  }

  @Test
  void cancelMatchReturns400WithoutUserHeader() throws Exception {
    mockMvc
        .perform(delete("/v1/pickup/requests/7/match"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("X-User-Id is required"));
  }
}
