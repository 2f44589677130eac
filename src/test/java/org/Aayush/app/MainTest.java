package org.Aayush.app;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {

    private static String fixture(String name) throws URISyntaxException {
        return Path.of(MainTest.class.getResource("/fixtures/gdppc/" + name).toURI()).toString();
    }

    @Test
    void testGdppcCommandPrintsSeries() throws URISyntaxException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        int code = Main.run(new String[]{
                "gdppc", "low", "SSP3",
                fixture("growth.csv"), fixture("baseline.csv"), fixture("nightlights.csv"),
                "USA.1.1"
        }, new PrintStream(out), new PrintStream(err));

        String output = out.toString();
        assertEquals(Main.EXIT_OK, code);
        assertTrue(output.startsWith("region,year,value"));
        assertTrue(output.contains("USA.1.1,2010,50.0"));
        assertTrue(output.contains("USA.1.1,2100,"));
    }

    @Test
    void testUnknownCommandPrintsUsage() {
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        int code = Main.run(new String[]{"wages"}, new PrintStream(new ByteArrayOutputStream()), new PrintStream(err));

        assertEquals(Main.EXIT_USAGE, code);
        assertTrue(err.toString().contains("usage:"));
    }

    @Test
    void testMissingArgumentsPrintUsage() {
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        assertEquals(Main.EXIT_USAGE, Main.run(new String[0], System.out, new PrintStream(err)));
        assertEquals(Main.EXIT_USAGE, Main.run(new String[]{"pop", "SSP2"}, System.out, new PrintStream(err)));
    }

    @Test
    void testShortRegionIdPrintsUsageBeforeAnyOutput() throws URISyntaxException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        int code = Main.run(new String[]{
                "gdppc", "low", "SSP3",
                fixture("growth.csv"), fixture("baseline.csv"), fixture("nightlights.csv"),
                "USA.1.1", "US"
        }, new PrintStream(out), new PrintStream(err));

        assertEquals(Main.EXIT_USAGE, code);
        assertEquals("", out.toString());
        assertTrue(err.toString().contains("'US'"));
    }

    @Test
    void testUnknownScenarioReportsFailure() throws URISyntaxException {
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        int code = Main.run(new String[]{
                "gdppc", "low", "SSP9",
                fixture("growth.csv"), fixture("baseline.csv"), fixture("nightlights.csv"),
                "USA"
        }, new PrintStream(new ByteArrayOutputStream()), new PrintStream(err));

        assertEquals(Main.EXIT_FAILURE, code);
        assertTrue(err.toString().contains("EX_SCENARIO_NOT_FOUND"));
    }
}
