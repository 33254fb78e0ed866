package com.jay.fiipulse.layer1_data.market;

import com.jay.fiipulse.model.PriceBar;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

/**
 * Daily OHLCV history for one market-data ticker, oldest bar first.
 * Bars with any missing field are left out; an unknown ticker gives an empty list.
 */
public interface PriceHistoryProvider {

    List<PriceBar> fetchDaily(String ticker, LocalDate from, LocalDate to) throws IOException;
}
