package com.tcrimer.app;

import org.apache.commons.cli.Options;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TcrimerApplicationTest {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void captureStreams() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStreams() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void listStrategiesShouldPrintEveryPresetWithoutTouchingTheDatabase() {
        int exit = new TcrimerApplication().run(new String[]{"--list-strategies"});

        String printed = out.toString(StandardCharsets.UTF_8);
        assertEquals(0, exit);
        assertTrue(printed.contains("ma_crossover(long=50,short=20)"));
        assertTrue(printed.contains("rsi_threshold(overbought=75,oversold=25,period=7)"));
        assertTrue(printed.contains("macd_signal(fast=8,signal=9,slow=17)"));
    }

    @Test
    void unknownOptionShouldExitWithUsageError() {
        assertEquals(2, new TcrimerApplication().run(new String[]{"--frobnicate"}));
        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("ERROR:"));
    }

    @Test
    void malformedParamShouldExitWithUsageError() {
        assertEquals(2, new TcrimerApplication().run(new String[]{"--backtest", "--param", "short"}));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("expected name=value"));
    }

    @Test
    void noArgumentsShouldPrintHelp() {
        assertEquals(0, new TcrimerApplication().run(new String[0]));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("--backtest"));
    }

    @Test
    void optionsShouldExposeEveryCommand() {
        Options options = TcrimerApplication.buildOptions();

        for (String name : new String[]{"backtest", "indicator", "list-strategies", "sync-fallback", "cache-stats", "maintenance", "vacuum", "param"}) {
            assertTrue(options.hasLongOption(name), name);
        }
    }
}
