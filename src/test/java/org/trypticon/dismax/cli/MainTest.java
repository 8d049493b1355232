package org.trypticon.dismax.cli;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.trypticon.dismax.TestIndices;
import org.trypticon.dismax.Utils;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertEquals;

public class MainTest {
    private Path temp;
    private ByteArrayOutputStream rawOut;
    private ByteArrayOutputStream rawErr;
    private PrintStream out;
    private PrintStream err;
    private int result;

    @Before
    public void setUp() throws Exception {
        temp = Files.createTempDirectory("test");
        rawOut = new ByteArrayOutputStream();
        rawErr = new ByteArrayOutputStream();
        out = new PrintStream(rawOut, true, StandardCharsets.UTF_8);
        err = new PrintStream(rawErr, true, StandardCharsets.UTF_8);
        try (Directory directory = FSDirectory.open(temp)) {
            TestIndices.writeIndex(directory, TestIndices.corpus(), 3);
        }
    }

    @After
    public void tearDown() throws Exception {
        Utils.recursiveDeleteIfExists(temp);
    }

    @Test
    public void testNoArguments() {
        run();
        assertResult(1);
        assertOutput();
        assertError("usage: dismax <command> <args...>",
                "Available commands:",
                "  help",
                "  search",
                "  date",
                "Use dismax help <command> for help on a specific command.");
    }

    @Test
    public void testUnknown() {
        run("pickle");
        assertResult(1);
        assertOutput();
        assertError("Unknown command: pickle",
                "Available commands:",
                "  help",
                "  search",
                "  date");
    }

    @Test
    public void testHelp() {
        run("help", "search");
        assertResult(0);
        assertOutput();
        assertError("dismax search - Searches a text index for the best match of several terms",
                "usage: dismax search [--verbose] <index dir> <tie breaker> <field:term>...");
    }

    @Test
    public void testHelp_Unknown() {
        run("help", "pickle");
        assertResult(1);
        assertOutput();
        assertError("Unknown command: pickle",
                "Available commands:",
                "  help",
                "  search",
                "  date");
    }

    @Test
    public void testSearch() {
        run("search", temp.toString(), "0", "title:apple", "body:apple");
        assertResult(0);
        String[] lines = output().split(System.lineSeparator());
        assertEquals(5, lines.length);
        assertEquals("4 total hits", lines[0]);
        assertThat(lines[1], startsWith("doc=0 score="));
        assertThat(lines[2], startsWith("doc=1 score="));
        assertThat(lines[3], startsWith("doc=2 score="));
        assertThat(lines[4], startsWith("doc=4 score="));
        assertError();
    }

    @Test
    public void testSearch_NoMatches() {
        run("search", temp.toString(), "0.1", "title:durian");
        assertResult(0);
        assertOutput("0 total hits");
        assertError();
    }

    @Test
    public void testSearch_Verbose() {
        run("search", "--verbose", temp.toString(), "0.1", "title:apple", "body:apple");
        assertResult(0);
        assertThat(error(), containsString("LI: opened " + temp + " with 2 segments and 6 live docs"));
        assertThat(error(), containsString("IS: (title:apple | body:apple)~0.1: 4 total hits in 2 readers"));
    }

    @Test
    public void testSearch_TooFewArguments() {
        run("search", temp.toString(), "0.1");
        assertResult(1);
        assertOutput();
        assertError("usage: dismax search [--verbose] <index dir> <tie breaker> <field:term>...");
    }

    @Test
    public void testSearch_InvalidNumber() {
        run("search", temp.toString(), "X", "title:apple");
        assertResult(1);
        assertOutput();
        assertError("Not a number: X");
    }

    @Test
    public void testSearch_InvalidClause() {
        run("search", temp.toString(), "0.1", "title:apple", "apple");
        assertResult(1);
        assertOutput();
        assertError("Not a field:term clause: apple");
    }

    @Test
    public void testSearch_InvalidPath() {
        Path invalid = temp.resolve("invalid");
        run("search", invalid.toString(), "0.1", "title:apple");
        assertResult(1);
        assertOutput();
        assertThat(error(), startsWith("Error searching Lucene index at: " + invalid + System.lineSeparator()));
    }

    @Test
    public void testDateFormat() {
        run("date", "format", "2004-09-21T13:50:11.123", "minute");
        assertResult(0);
        assertOutput("200409211350");
        assertError();
    }

    @Test
    public void testDateFormat_YearTooLarge() {
        run("date", "format", "+10000-01-01T00:00:00", "day");
        assertResult(1);
        assertOutput();
        assertError("Cannot format date-time: +10000-01-01T00:00:00",
                "Year out of range 0 to 9999: +10000-01-01T00:00:00Z");
    }

    @Test
    public void testDateFormat_InvalidDateTime() {
        run("date", "format", "yesterday", "day");
        assertResult(1);
        assertOutput();
        assertError("Not a date-time: yesterday");
    }

    @Test
    public void testDateFormat_InvalidResolution() {
        run("date", "format", "2004-09-21T13:50:11", "fortnight");
        assertResult(1);
        assertOutput();
        assertError("Unknown resolution: fortnight");
    }

    @Test
    public void testDateParse() {
        run("date", "parse", "200409");
        assertResult(0);
        assertOutput("2004-09-01T00:00:00");
        assertError();
    }

    @Test
    public void testDateParse_Invalid() {
        run("date", "parse", "2004x");
        assertResult(1);
        assertOutput();
        assertError("Error parsing date string: 2004x",
                "java.text.ParseException: Input is not a valid date string: 2004x");
    }

    private void run(String... args) {
        result = new Main().run(List.of(args), out, err);
    }

    private String output() {
        return rawOut.toString(StandardCharsets.UTF_8).trim();
    }

    private String error() {
        return rawErr.toString(StandardCharsets.UTF_8).trim();
    }

    private void assertResult(int expected) {
        assertEquals(expected, result);
    }

    private void assertOutput(String... expectedLines) {
        String expected = String.join(System.lineSeparator(), expectedLines);
        assertEquals(expected, output());
    }

    private void assertError(String... expectedLines) {
        String expected = String.join(System.lineSeparator(), expectedLines);
        assertEquals(expected, error());
    }
}
