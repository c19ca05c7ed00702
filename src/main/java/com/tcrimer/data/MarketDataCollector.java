package com.tcrimer.data;

import com.tcrimer.model.Bar;
import com.tcrimer.model.TimeRange;
import com.tcrimer.model.TimeSeries;
import com.tcrimer.model.Timeframe;

/**
 * Upstream source of OHLCV data. Implementations may be slow or fail; {@link MarketDataService}
 * puts the cache, the store and a timeout in front of them.
 */
public interface MarketDataCollector {

    TimeSeries fetchSeries(String symbol, Timeframe timeframe, TimeRange range) throws MarketDataException;

    Bar fetchLatest(String symbol) throws MarketDataException;

    /**
     * Short tag stored with persisted bars.
     */
    String sourceName();
}
