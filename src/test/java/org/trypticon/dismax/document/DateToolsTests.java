package org.trypticon.dismax.document;

import org.junit.Test;
import org.trypticon.dismax.document.DateTools.Resolution;

import java.text.ParseException;
import java.util.Date;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

/**
 * Tests for {@link DateTools}.
 */
public class DateToolsTests {
    // 2004-09-21T13:50:11.123Z
    private static final long TIME = 1095774611123L;

    @Test
    public void testTimeToStringAtEachResolution() {
        assertThat(DateTools.timeToString(TIME, Resolution.YEAR), is("2004"));
        assertThat(DateTools.timeToString(TIME, Resolution.MONTH), is("200409"));
        assertThat(DateTools.timeToString(TIME, Resolution.DAY), is("20040921"));
        assertThat(DateTools.timeToString(TIME, Resolution.HOUR), is("2004092113"));
        assertThat(DateTools.timeToString(TIME, Resolution.MINUTE), is("200409211350"));
        assertThat(DateTools.timeToString(TIME, Resolution.SECOND), is("20040921135011"));
        assertThat(DateTools.timeToString(TIME, Resolution.MILLISECOND), is("20040921135011123"));
    }

    @Test
    public void testDateToStringMatchesTimeToString() {
        assertThat(DateTools.dateToString(new Date(TIME), Resolution.MINUTE), is("200409211350"));
    }

    @Test
    public void testStringToTimeFillsMissingFields() throws Exception {
        assertThat(DateTools.stringToTime("2004"), is(1072915200000L));
        assertThat(DateTools.stringToTime("200409"), is(1093996800000L));
        assertThat(DateTools.stringToTime("20040921"), is(1095724800000L));
        assertThat(DateTools.stringToTime("20040921135011"), is(1095774611000L));
        assertThat(DateTools.stringToTime("20040921135011123"), is(TIME));
        assertThat(DateTools.stringToDate("20040921135011123"), is(new Date(TIME)));
    }

    @Test
    public void testEveryResolutionRoundTripsToRoundedTime() throws Exception {
        for (Resolution resolution : Resolution.values()) {
            String string = DateTools.timeToString(TIME, resolution);

            assertThat(resolution.toString(), string.length(), is(resolution.getFormatLength()));
            assertThat(resolution.toString(), DateTools.stringToTime(string), is(DateTools.round(TIME, resolution)));
        }
    }

    @Test
    public void testRound() {
        assertThat(DateTools.round(1095774611000L, Resolution.MONTH), is(1093996800000L));
        assertThat(DateTools.round(TIME, Resolution.SECOND), is(1095774611000L));
        assertThat(DateTools.round(TIME, Resolution.MILLISECOND), is(TIME));
        assertThat(DateTools.round(new Date(TIME), Resolution.DAY), is(new Date(1095724800000L)));
    }

    @Test
    public void testBeforeEpoch() throws Exception {
        assertThat(DateTools.timeToString(-1L, Resolution.MILLISECOND), is("19691231235959999"));
        assertThat(DateTools.round(-1L, Resolution.DAY), is(-86400000L));
        assertThat(DateTools.stringToTime("19611112"), is(-256780800000L));
    }

    @Test
    public void testFourDigitYearLimits() {
        // 0000-01-01T00:00:00Z and 10000-01-01T00:00:00Z
        long firstOfYearZero = -62167219200000L;
        long firstOfYear10000 = 253402300800000L;
        assertThat(DateTools.timeToString(firstOfYearZero, Resolution.DAY), is("00000101"));
        assertThat(DateTools.timeToString(firstOfYear10000 - 1, Resolution.SECOND), is("99991231235959"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> DateTools.timeToString(firstOfYear10000, Resolution.DAY));
        assertThat(e.getMessage(), is("Year out of range 0 to 9999: +10000-01-01T00:00:00Z"));
        assertThrows(IllegalArgumentException.class,
                () -> DateTools.timeToString(firstOfYearZero - 1, Resolution.YEAR));
    }

    @Test
    public void testInvalidStrings() {
        assertThrows(ParseException.class, () -> DateTools.stringToTime(""));
        assertThrows(ParseException.class, () -> DateTools.stringToTime("97"));
        assertThrows(ParseException.class, () -> DateTools.stringToTime("200"));
        assertThrows(ParseException.class, () -> DateTools.stringToTime("2004-09-21"));
        assertThrows(ParseException.class, () -> DateTools.stringToTime("20041321"));
        assertThrows(ParseException.class, () -> DateTools.stringToTime("20040231"));
        assertThrows(ParseException.class, () -> DateTools.stringToTime("2004092125"));
        assertThrows(ParseException.class, () -> DateTools.stringToTime("abcd"));
    }

    @Test
    public void testInvalidStringMessage() {
        ParseException e = assertThrows(ParseException.class, () -> DateTools.stringToTime("2004x"));

        assertThat(e.getMessage(), is("Input is not a valid date string: 2004x"));
    }

    @Test
    public void testResolutionParse() throws Exception {
        assertThat(Resolution.parse("day"), is(Resolution.DAY));
        assertThat(Resolution.parse("MilliSecond"), is(Resolution.MILLISECOND));

        ParseException e = assertThrows(ParseException.class, () -> Resolution.parse("fortnight"));
        assertThat(e.getMessage(), is("Unknown resolution: fortnight"));
    }

    @Test
    public void testResolutionToStringIsLowerCase() {
        assertThat(Resolution.HOUR.toString(), is("hour"));
    }
}
