package com.flighthelp.matching.model;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Locale;

/** 送迎系統の旅程キー。空港と日付は一致、時刻は許容幅の範囲内で照合する。 */
public record PickupItinerary(String airport, LocalDate date, LocalTime time) {

  public boolean compatibleWith(PickupItinerary other, Duration tolerance) {
    if (other == null || date == null || time == null || other.time == null) {
      return false;
    }
    if (!normalizedAirport().equals(other.normalizedAirport()) || !date.equals(other.date)) {
      return false;
    }
    final long gapSeconds = Math.abs(Duration.between(time, other.time).toSeconds());
    return gapSeconds <= tolerance.toSeconds();
  }

  public String normalizedAirport() {
    return airport == null ? "" : airport.trim().toUpperCase(Locale.ROOT);
  }

  public String summary() {
    return airport + " " + date + " " + time;
  }
}
