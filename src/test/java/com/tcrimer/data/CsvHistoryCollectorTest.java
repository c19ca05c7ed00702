package com.tcrimer.data;

import com.tcrimer.model.Bar;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CsvHistoryCollectorTest {

    @Test
    void parseCsvShouldSortDedupeAndSkipBadLines() throws Exception {
        String body = "Date,Open,High,Low,Close,Volume\n"
                + "2024-01-03,11,12,10,11.5,300\n"
                + "2024-01-02,10,11,9,10.5,200\n"
                + "2024-01-02,10,11,9,99,200\n"
                + "garbage\n"
                + "2024-01-04,12,13,11,0,100\n"
                + "2024-01-05,12,13,11,abc,100\n"
                + "\n"
                + "2024-01-06,12,13,11,12.5\n";

        List<Bar> bars = CsvHistoryCollector.parseCsv("AAPL", body);

        assertEquals(3, bars.size());
        assertEquals(Instant.parse("2024-01-02T00:00:00Z"), bars.get(0).timestamp);
        assertEquals(10.5, bars.get(0).close, 1e-9);
        assertEquals(11.5, bars.get(1).close, 1e-9);
        assertEquals(0.0, bars.get(2).volume, 1e-9);
    }

    @Test
    void epochMillisTimestampsShouldBeAccepted() throws Exception {
        String body = "date,open,high,low,close,volume\n1704067200000,1,2,0.5,1.5,10\n";

        List<Bar> bars = CsvHistoryCollector.parseCsv("AAPL", body);

        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), bars.get(0).timestamp);
    }

    @Test
    void noDataShouldParseAsEmpty() throws Exception {
        assertTrue(CsvHistoryCollector.parseCsv("AAPL", "No data").isEmpty());
        assertTrue(CsvHistoryCollector.parseCsv("AAPL", null).isEmpty());
    }

    @Test
    void unexpectedPayloadShouldFail() {
        MarketDataException e = assertThrows(MarketDataException.class,
                () -> CsvHistoryCollector.parseCsv("AAPL", "<html>maintenance</html>"));

        assertTrue(e.getMessage().startsWith("unexpected payload"));
        assertThrows(MarketDataException.class,
                () -> CsvHistoryCollector.parseCsv("AAPL", "Exceeded the daily hits limit"));
    }
}
