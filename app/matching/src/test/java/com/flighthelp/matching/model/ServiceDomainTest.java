package com.flighthelp.matching.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class ServiceDomainTest {

  @Test
  void fromValueAcceptsKnownValuesIgnoringCase() {
    assertThat(ServiceDomain.fromValue("flight-companion"))
        .isEqualTo(ServiceDomain.FLIGHT_COMPANION);
    assertThat(ServiceDomain.fromValue("PICKUP")).isEqualTo(ServiceDomain.PICKUP);
  }

  @Test
  void fromValueRejectsUnknownValue() {
    assertThatThrownBy(() -> ServiceDomain.fromValue("taxi"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("taxi");
  }

  @Test
  void amountBoundsDifferPerDomain() {
    assertThat(ServiceDomain.FLIGHT_COMPANION.isAmountWithinBounds(new BigDecimal("500")))
        .isTrue();
    assertThat(ServiceDomain.PICKUP.isAmountWithinBounds(new BigDecimal("200.00"))).isTrue();
    assertThat(ServiceDomain.PICKUP.isAmountWithinBounds(new BigDecimal("200.01"))).isFalse();
    assertThat(ServiceDomain.PICKUP.isAmountWithinBounds(new BigDecimal("-1"))).isFalse();
    assertThat(ServiceDomain.PICKUP.isAmountWithinBounds(null)).isFalse();
  }
}
