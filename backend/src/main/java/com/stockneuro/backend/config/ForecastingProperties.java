package com.stockneuro.backend.config;

import com.stockneuro.backend.forecasting.benchmark.WalkForwardPlan;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "stockneuro")
@Data
public class ForecastingProperties {

    private Training training = new Training();
    private Metrics metrics = new Metrics();
    private Conformal conformal = new Conformal();
    private Analogue analogue = new Analogue();
    private Registry registry = new Registry();
    private Benchmark benchmark = new Benchmark();
    private Models models = new Models();
    private MarketData marketData = new MarketData();

    @Data
    public static class Training {
        private double trainFraction = 0.8;
        private int minSamplesForStacked = 100;
        private String defaultPeriod = "2y";
        private Defaults defaults = new Defaults();
    }

    @Data
    public static class Defaults {
        private int sequenceLength = 60;
        private int hiddenUnits = 50;
        private double dropout = 0.2;
        private double learningRate = 0.001;
        private int epochs = 20;
        private int batchSize = 32;
        private int layers = 1;
        private long seed = 42L;
    }

    @Data
    public static class Metrics {
        private double tolerance = 0.075;
    }

    @Data
    public static class Conformal {
        private int minCalibrationSize = 20;
        private double defaultCoverage = 0.9;
        private double adaptationRate = 0.01;
    }

    @Data
    public static class Analogue {
        private int windowLength = 30;
        private int stride = 5;
        private int maxResults = 5;
    }

    @Data
    public static class Registry {
        private String artifactDir = "./data/artifacts";
    }

    @Data
    public static class Benchmark {
        private int repeats = 3;
        private double trainFraction = 0.7;
        private double validationFraction = 0.15;
        private double reproducibilityTolerance = 5.0;
        private WalkForward walkForward = new WalkForward();
    }

    @Data
    public static class WalkForward {
        private WalkForwardPlan.Strategy strategy = WalkForwardPlan.Strategy.ROLLING;
        private int trainSize = 100;
        private int testSize = 20;
        private int stepSize = 10;
    }

    @Data
    public static class Models {
        private PatchTst patchTst = new PatchTst();
        private ZeroShot zeroShot = new ZeroShot();
    }

    @Data
    public static class PatchTst {
        private int patchLength = 16;
        private int stride = 8;
        private int heads = 4;
    }

    @Data
    public static class ZeroShot {
        private String weightsPath;
        private int trendLookback = 10;
    }

    @Data
    public static class MarketData {
        private String dataDir = "./data/prices";
    }
}
