package com.flamingo.ai.tenderlens.service.cleaning;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("Truncator Tests")
class TruncatorTest {

  private final Truncator truncator = new Truncator();

  @Test
  @DisplayName("Should return text within budget unchanged")
  void shouldReturnShortTextUnchanged() {
    assertThat(truncator.truncate("поставка бумаги", 15)).isEqualTo("поставка бумаги");
    assertThat(truncator.truncate("", 0)).isEmpty();
  }

  @Test
  @DisplayName("Should cut back to a word boundary near the end of the budget")
  void shouldCutAtWordBoundary() {
    String text = "abcdefghijklmnopqrs tail";

    assertThat(truncator.truncate(text, 20)).isEqualTo("abcdefghijklmnopqrs");
  }

  @Test
  @DisplayName("Should cut mid-word when the boundary is too far back")
  void shouldCutMidWordWhenBoundaryTooFar() {
    String text = "aaaa bbbb cccc dddd";

    assertThat(truncator.truncate(text, 12)).isEqualTo("aaaa bbbb cc");
  }

  @Test
  @DisplayName("Should take a boundary exactly at ninety percent")
  void shouldTakeBoundaryAtNinetyPercent() {
    assertThat(truncator.truncate("abcdefghijklmnopqr stuvwxyz", 20))
        .isEqualTo("abcdefghijklmnopqr");
    assertThat(truncator.truncate("aaaaaaaaa bbbbbbbbb", 10)).isEqualTo("aaaaaaaaa");
  }

  @ParameterizedTest
  @ValueSource(ints = {0, 1, 5, 10, 19, 20, 21, 100})
  @DisplayName("Should never exceed the budget and be idempotent")
  void shouldBoundLengthAndBeIdempotent(int maxChars) {
    String text = "Бумага офисная формата А4 белизна 146 процентов плотность 80 грамм";

    String once = truncator.truncate(text, maxChars);

    assertThat(once.length()).isLessThanOrEqualTo(Math.min(maxChars, text.length()));
    assertThat(truncator.truncate(once, maxChars)).isEqualTo(once);
    assertThat(text).startsWith(once);
  }

  @Test
  @DisplayName("Should reject a negative budget")
  void shouldRejectNegativeBudget() {
    assertThatThrownBy(() -> truncator.truncate("text", -1))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
