package com.stockneuro.backend.service;

import com.stockneuro.backend.config.ForecastingProperties;
import com.stockneuro.backend.exception.BadRequestException;
import com.stockneuro.backend.exception.CalibrationInsufficientException;
import com.stockneuro.backend.exception.InsufficientDataException;
import com.stockneuro.backend.exception.NotFoundException;
import com.stockneuro.backend.forecasting.adapter.Architecture;
import com.stockneuro.backend.forecasting.adapter.ModelAdapter;
import com.stockneuro.backend.forecasting.adapter.ModelAdapterRegistry;
import com.stockneuro.backend.forecasting.adapter.ModelHandle;
import com.stockneuro.backend.forecasting.analogue.AnalogueMatch;
import com.stockneuro.backend.forecasting.analogue.AnalogueRetriever;
import com.stockneuro.backend.forecasting.conformal.CalibrationSet;
import com.stockneuro.backend.forecasting.conformal.CalibrationStore;
import com.stockneuro.backend.forecasting.conformal.ConformalPredictor;
import com.stockneuro.backend.forecasting.conformal.PredictionInterval;
import com.stockneuro.backend.forecasting.data.ScaleParams;
import com.stockneuro.backend.forecasting.data.SequencePreprocessor;
import com.stockneuro.backend.forecasting.data.Window;
import com.stockneuro.backend.forecasting.registry.ModelRegistryService;
import com.stockneuro.backend.model.ModelVersion;
import com.stockneuro.backend.service.marketdata.MarketDataProvider;
import com.stockneuro.backend.service.marketdata.PriceSeries;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Serves forecasts from the promoted version of an architecture. Forecasting is recursive:
 * each step's prediction is appended to the context for the next step. Intervals and
 * analogues annotate the point forecasts and never change them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ForecastService {

    static final int MAX_HORIZON = 365;

    private final MarketDataProvider marketDataProvider;
    private final SequencePreprocessor preprocessor;
    private final ModelAdapterRegistry adapters;
    private final ModelRegistryService registry;
    private final ConformalPredictor conformalPredictor;
    private final CalibrationStore calibrationStore;
    private final AnalogueRetriever analogueRetriever;
    private final ForecastMetricsService metricsService;
    private final ForecastingProperties properties;

    private final Map<Architecture, LoadedModel> loadedModels = new ConcurrentHashMap<>();

    public ForecastResult getForecast(String ticker, Architecture architecture, int horizon, Double coverage) {
        if (horizon < 1 || horizon > MAX_HORIZON) {
            throw new BadRequestException("Horizon must be between 1 and " + MAX_HORIZON);
        }
        if (coverage != null && !(coverage > 0.0 && coverage < 1.0)) {
            throw new BadRequestException("Coverage must be in (0, 1)");
        }
        ModelVersion version = registry.requirePromoted(architecture);
        ModelAdapter adapter = adapters.get(architecture);
        ModelHandle handle = load(version, adapter);
        PriceSeries series = marketDataProvider.fetchPriceHistory(ticker, properties.getTraining().getDefaultPeriod());
        int length = version.getSequenceLength();
        if (series.size() <= length) {
            throw new InsufficientDataException("Forecasting with " + architecture + " v" + version.getVersionNumber()
                    + " needs more than " + length + " closes, got " + series.size());
        }
        ScaleParams params = scaleFor(version, series);
        double[] scaled = preprocessor.apply(series.closes(), params);

        double[] context = Arrays.copyOfRange(scaled, scaled.length - length, scaled.length);
        double[] scaledForecasts = new double[horizon];
        synchronized (handle) {
            for (int step = 0; step < horizon; step++) {
                double next = adapter.predictOne(handle, new Window(series.size() + step, context, Double.NaN));
                scaledForecasts[step] = next;
                System.arraycopy(context, 1, context, 0, length - 1);
                context[length - 1] = next;
            }
        }

        Double halfWidth = null;
        String unavailable = null;
        if (coverage != null) {
            try {
                CalibrationSet calibration = calibrationFor(version, adapter, handle, series.ticker(), scaled);
                PredictionInterval first = conformalPredictor.adaptiveInterval(scaledForecasts[0], calibration, coverage);
                halfWidth = first.upper() - scaledForecasts[0];
            } catch (CalibrationInsufficientException | InsufficientDataException ex) {
                unavailable = ex.getMessage();
                log.info("Intervals unavailable for {} v{}: {}", architecture, version.getVersionNumber(), unavailable);
            }
        }

        List<ForecastResult.ForecastPoint> points = new ArrayList<>(horizon);
        for (int step = 0; step < horizon; step++) {
            double value = params.unscale(scaledForecasts[step]);
            Double lower = halfWidth == null ? null : params.unscale(scaledForecasts[step] - halfWidth);
            Double upper = halfWidth == null ? null : params.unscale(scaledForecasts[step] + halfWidth);
            points.add(new ForecastResult.ForecastPoint(step + 1, value, lower, upper));
        }
        metricsService.recordForecast(architecture);
        return new ForecastResult(series.ticker(), architecture, version.getVersionNumber(), series.lastDate(),
                points, coverage, unavailable, analogues(series));
    }

    /**
     * Scores the last one-step interval issued for the promoted version against the
     * realized close and updates the adaptive coverage level.
     */
    public ObservationResult observe(String ticker, Architecture architecture, double actual) {
        ModelVersion version = registry.requirePromoted(architecture);
        CalibrationSet calibration = calibrationStore.find(version.getId())
                .orElseThrow(() -> new NotFoundException("No calibration for " + architecture + " v"
                        + version.getVersionNumber() + "; request a forecast with coverage first"));
        if (calibration.lastInterval() == null) {
            throw new BadRequestException("No interval has been issued for " + architecture + " v"
                    + version.getVersionNumber());
        }
        PriceSeries series = marketDataProvider.fetchPriceHistory(ticker, properties.getTraining().getDefaultPeriod());
        double scaledActual = scaleFor(version, series).scale(actual);
        boolean covered = conformalPredictor.observe(calibration, scaledActual);
        return new ObservationResult(architecture, version.getVersionNumber(), covered,
                1.0 - calibration.effectiveAlpha(), calibration.empiricalCoverage(), calibration.observations());
    }

    private ScaleParams scaleFor(ModelVersion version, PriceSeries series) {
        if (version.getTicker().equalsIgnoreCase(series.ticker())) {
            return version.scaleParams();
        }
        return preprocessor.scale(series.closes()).params();
    }

    /**
     * Rebuilds residuals on the held-out tail of the series in the same scale the point
     * forecasts use, so half-widths unscale consistently.
     */
    private CalibrationSet calibrationFor(ModelVersion version, ModelAdapter adapter, ModelHandle handle,
                                          String ticker, double[] scaled) {
        return calibrationStore.computeIfAbsent(version.getId(), id -> {
            List<Window> windows = preprocessor.window(scaled, version.getSequenceLength());
            int trainCount = (int) Math.floor(windows.size() * properties.getTraining().getTrainFraction());
            List<Window> heldOut = windows.subList(trainCount, windows.size());
            log.info("Rebuilding calibration for {} v{} from {} held-out windows of {}", version.getArchitecture(),
                    version.getVersionNumber(), heldOut.size(), ticker);
            synchronized (handle) {
                return conformalPredictor.calibrate(id, adapter, handle, heldOut);
            }
        });
    }

    private List<AnalogueMatch> analogues(PriceSeries series) {
        int length = properties.getAnalogue().getWindowLength();
        if (series.size() <= length) {
            return List.of();
        }
        analogueRetriever.index(series.ticker(), series.dates(), series.closes());
        double[] closes = series.closes();
        double[] query = Arrays.copyOfRange(closes, closes.length - length, closes.length);
        return analogueRetriever.retrieve(series.ticker() + "@" + series.lastDate(), query,
                properties.getAnalogue().getMaxResults());
    }

    private ModelHandle load(ModelVersion version, ModelAdapter adapter) {
        LoadedModel loaded = loadedModels.compute(version.getArchitecture(), (architecture, current) -> {
            if (current != null && current.versionId().equals(version.getId())) {
                return current;
            }
            log.info("Loading {} v{} from {}", architecture, version.getVersionNumber(), version.getArtifactRef());
            return new LoadedModel(version.getId(), adapter.restore(registry.loadArtifact(version)));
        });
        return loaded.handle();
    }

    private record LoadedModel(Long versionId, ModelHandle handle) {
    }

    public record ObservationResult(
            Architecture architecture,
            int versionNumber,
            boolean covered,
            double effectiveLevel,
            double empiricalCoverage,
            long observations
    ) {
    }
}
