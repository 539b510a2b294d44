package org.waabox.nexus.query;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ResultFormatter}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ResultFormatterTest {

  @Test
  void whenFormatting_givenMissingResult_shouldPrintDnf() {
    assertEquals("DNF", ResultFormatter.format("333", 0));
    assertEquals("DNF", ResultFormatter.format("333", -1));
    assertEquals("DNF", ResultFormatter.format("333fm", -2));
  }

  @Test
  void whenFormatting_givenTimedEvent_shouldPrintMinutesSecondsHundredths() {
    assertEquals("00:07.34", ResultFormatter.format("333", 734));
    assertEquals("01:05.23", ResultFormatter.format("444", 6523));
    assertEquals("09:59.99", ResultFormatter.format("777", 59999));
  }

  @Test
  void whenFormatting_givenTenMinutesOrMore_shouldDropHundredths() {
    assertEquals("10:00.00", ResultFormatter.format("666", 60012));
    assertEquals("61:01.00", ResultFormatter.format("555bf", 366178));
  }

  @Test
  void whenFormatting_givenFewestMoves_shouldPrintMoves() {
    assertEquals("25 moves", ResultFormatter.format("333fm", 25));
  }

  @Test
  void whenFormatting_givenMultiBlind_shouldPrintItsTime() {
    assertEquals("59:00", ResultFormatter.format("333mbf", 970354001));
    assertEquals("59:00", ResultFormatter.format("333mbf", 1010203540));
  }

  @Test
  void whenComparing_givenEachKindOfEvent_shouldUseHundredths() {
    assertEquals(734L, ResultFormatter.comparableTime("333", 734));
    assertEquals(2500L, ResultFormatter.comparableTime("333fm", 25));
    assertEquals(354000L,
        ResultFormatter.comparableTime("333mbf", 970354001));
    assertEquals(Long.MAX_VALUE, ResultFormatter.comparableTime("333", -1));
  }
}
