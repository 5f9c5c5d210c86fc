package ca.gc.cra.balancer.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void parsesWholeAndFractionalRates() {
    assertEquals(List.of(480.0, 7.5, 0.0), Numbers.parseRateList("inputs", " 480 ,7.5,0"));
  }

  @Test
  void rejectsMalformedRateLists() {
    IllegalArgumentException empty = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseRateList("inputs", "1,,2"));
    assertEquals("inputs contains an empty entry", empty.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseRateList("inputs", "1,"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseRateList("inputs", "1,two"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseRateList("outputs", "-5"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseRateList("outputs", "NaN"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseRateList("outputs", "Infinity"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseRateList("outputs", "   "));
  }

  @Test
  void detectsWholeRates() {
    assertTrue(Numbers.allWhole(List.of(45.0, 0.0)));
    assertFalse(Numbers.allWhole(List.of(45.0, 0.5)));
    assertFalse(Numbers.allWhole(List.of(3.0e12)));
  }

  @Test
  void enforcesInclusiveRange() {
    assertEquals(5L, Numbers.requireRange("target", 5, 0, 5));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("target", -1, 0, 5));
    assertEquals("target must be between 0 and 5 (was -1)", ex.getMessage());
  }

  @Test
  void stringsRejectControlAndNonAscii() {
    assertEquals("abc", Strings.requireNonBlank("name", "  abc "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "a\u0007b"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "team=café", 64));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "abcdef", 3));
    assertEquals("team=ops", Strings.requirePrintableAscii("attrs", "team=ops", 64));
  }
}
