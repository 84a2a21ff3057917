package com.flighthelp.matching.model;

import java.time.LocalDate;
import java.util.Locale;
import java.util.regex.Pattern;

/** 同行系統の旅程キー。便名・日付・出発/到着空港の完全一致で照合する。 */
public record FlightItinerary(
    String flightNumber, LocalDate flightDate, String departureAirport, String arrivalAirport) {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  public boolean sameFlightAs(FlightItinerary other) {
    return other != null
        && normalize(flightNumber).equals(normalize(other.flightNumber))
        && flightDate != null
        && flightDate.equals(other.flightDate)
        && normalize(departureAirport).equals(normalize(other.departureAirport))
        && normalize(arrivalAirport).equals(normalize(other.arrivalAirport));
  }

  /** 検索インデックスに合わせた正規化済みの旅程を返す。 */
  public FlightItinerary normalized() {
    return new FlightItinerary(
        normalize(flightNumber), flightDate, normalize(departureAirport), normalize(arrivalAirport));
  }

  public String summary() {
    return flightNumber + " " + flightDate + " " + departureAirport + "->" + arrivalAirport;
  }

  static String normalize(String value) {
    return value == null ? "" : WHITESPACE.matcher(value).replaceAll("").toUpperCase(Locale.ROOT);
  }
}
