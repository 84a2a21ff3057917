/*
 * どこで: Matching 設定のバリデーションテスト
 * 何を: MatchingProperties / MatchingNatsProperties の Bean Validation を検証する
 * なぜ: 起動時に不正なスコア重みや上限値を検出できるようにするため
 */
package com.flighthelp.matching.config;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MatchingPropertiesValidationTest {

  private static final Duration TOLERANCE = Duration.ofMinutes(120);
  private static final MatchingProperties.Scoring SCORING =
      new MatchingProperties.Scoring(0.4, 0.35, 0.25, 0.5, 10);

  private Validator validator;

  @BeforeEach
  void setUp() {
    validator = Validation.buildDefaultValidatorFactory().getValidator();
  }

  @Test
  void validationPassesWhenAllFieldsValid() {
    final MatchingProperties properties = new MatchingProperties(50, TOLERANCE, 0.2, SCORING);

    assertTrue(validator.validate(properties).isEmpty());
  }

  @Test
  void validationFailsWhenMaxResultsLimitIsZero() {
    final MatchingProperties properties = new MatchingProperties(0, TOLERANCE, 0.2, SCORING);

    assertFalse(validator.validate(properties).isEmpty());
  }

  @Test
  void validationFailsWhenPickupToleranceIsMissing() {
    final MatchingProperties properties = new MatchingProperties(50, null, 0.2, SCORING);

    assertFalse(validator.validate(properties).isEmpty());
  }

  @Test
  void validationFailsWhenWeightIsNegative() {
    final MatchingProperties properties =
        new MatchingProperties(
            50, TOLERANCE, 0.2, new MatchingProperties.Scoring(-0.1, 0.35, 0.25, 0.5, 10));

    assertFalse(validator.validate(properties).isEmpty());
  }

  @Test
  void validationFailsWhenNeutralReputationExceedsOne() {
    final MatchingProperties properties =
        new MatchingProperties(
            50, TOLERANCE, 0.2, new MatchingProperties.Scoring(0.4, 0.35, 0.25, 1.5, 10));

    assertFalse(validator.validate(properties).isEmpty());
  }

  @Test
  void validationFailsWhenNatsSubjectIsBlank() {
    assertFalse(validator.validate(new MatchingNatsProperties(" ")).isEmpty());
    assertTrue(
        validator.validate(new MatchingNatsProperties("matching.events.match-confirmed")).isEmpty());
  }
}
