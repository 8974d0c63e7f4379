package com.stockneuro.backend.service.marketdata;

import com.stockneuro.backend.config.ForecastingProperties;
import com.stockneuro.backend.exception.BadRequestException;
import com.stockneuro.backend.exception.DataUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads {@code <data-dir>/<TICKER>.csv} files with a {@code date,close} header, as exported
 * by the market-data collaborator.
 */
@Component
@Slf4j
public class CsvPriceHistoryProvider implements MarketDataProvider {

    static final int TRADING_DAYS_PER_MONTH = 21;
    private static final Pattern TICKER = Pattern.compile("[A-Za-z0-9.\\-^]{1,20}");
    private static final Map<String, Integer> PERIOD_MONTHS = Map.of(
            "1mo", 1, "3mo", 3, "6mo", 6, "1y", 12, "2y", 24, "5y", 60);

    private final Path dataDir;

    public CsvPriceHistoryProvider(ForecastingProperties properties) {
        this.dataDir = Paths.get(properties.getMarketData().getDataDir());
    }

    @Override
    public PriceSeries fetchPriceHistory(String ticker, String period) {
        if (ticker == null || !TICKER.matcher(ticker).matches()) {
            throw new BadRequestException("Invalid ticker: " + ticker);
        }
        int limit = barsFor(period);
        String symbol = ticker.toUpperCase(Locale.ROOT);
        Path file = dataDir.resolve(symbol + ".csv");
        if (!Files.isReadable(file)) {
            throw new DataUnavailableException("No price history available for " + symbol);
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new DataUnavailableException("Failed to read price history for " + symbol, ex);
        }
        List<LocalDate> dates = new ArrayList<>();
        List<Double> closes = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || (i == 0 && line.toLowerCase(Locale.ROOT).startsWith("date"))) {
                continue;
            }
            String[] parts = line.split(",");
            if (parts.length < 2) {
                throw new DataUnavailableException("Malformed row " + (i + 1) + " in " + file.getFileName());
            }
            try {
                dates.add(LocalDate.parse(parts[0].trim()));
                closes.add(Double.parseDouble(parts[parts.length - 1].trim()));
            } catch (DateTimeParseException | NumberFormatException ex) {
                throw new DataUnavailableException("Malformed row " + (i + 1) + " in " + file.getFileName(), ex);
            }
        }
        if (closes.isEmpty()) {
            throw new DataUnavailableException("Price history for " + symbol + " is empty");
        }
        int from = limit < 0 ? 0 : Math.max(0, closes.size() - limit);
        double[] values = new double[closes.size() - from];
        for (int i = from; i < closes.size(); i++) {
            values[i - from] = closes.get(i);
        }
        log.debug("Loaded {} closes for {} ({})", values.length, symbol, period);
        return new PriceSeries(symbol, dates.subList(from, dates.size()), values);
    }

    // -1 means the full history
    static int barsFor(String period) {
        if (period == null || period.isBlank() || "max".equalsIgnoreCase(period)) {
            return -1;
        }
        Integer months = PERIOD_MONTHS.get(period.toLowerCase(Locale.ROOT));
        if (months == null) {
            throw new BadRequestException("Unsupported period: " + period);
        }
        return months * TRADING_DAYS_PER_MONTH;
    }
}
