package com.stockneuro.backend.service.marketdata;

public interface MarketDataProvider {

    /**
     * @throws com.stockneuro.backend.exception.DataUnavailableException when no history can be supplied
     */
    PriceSeries fetchPriceHistory(String ticker, String period);
}
