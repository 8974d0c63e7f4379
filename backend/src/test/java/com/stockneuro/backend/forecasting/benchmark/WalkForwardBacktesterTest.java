package com.stockneuro.backend.forecasting.benchmark;

import com.stockneuro.backend.config.ForecastingProperties;
import com.stockneuro.backend.exception.BadRequestException;
import com.stockneuro.backend.exception.InsufficientDataException;
import com.stockneuro.backend.forecasting.adapter.Architecture;
import com.stockneuro.backend.forecasting.adapter.ModelAdapter;
import com.stockneuro.backend.forecasting.adapter.ModelAdapterRegistry;
import com.stockneuro.backend.forecasting.adapter.ModelHandle;
import com.stockneuro.backend.forecasting.adapter.NetworkTrainer;
import com.stockneuro.backend.forecasting.adapter.ZeroShotAdapter;
import com.stockneuro.backend.forecasting.brain.AutoLearningBrain;
import com.stockneuro.backend.forecasting.brain.TrainingRunLog;
import com.stockneuro.backend.forecasting.data.SequencePreprocessor;
import com.stockneuro.backend.forecasting.data.Window;
import com.stockneuro.backend.forecasting.metrics.MetricsEngine;
import com.stockneuro.backend.service.marketdata.MarketDataProvider;
import com.stockneuro.backend.util.InMemoryTrainingRuns;
import com.stockneuro.backend.util.TestSeriesFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WalkForwardBacktesterTest {

    private ForecastingProperties properties;
    private ModelAdapter flaky;
    private WalkForwardBacktester backtester;
    private AutoLearningBrain brain;

    @BeforeEach
    void setUp() {
        properties = new ForecastingProperties();
        MarketDataProvider marketData = mock(MarketDataProvider.class);
        when(marketData.fetchPriceHistory(eq("LIN"), anyString()))
                .thenReturn(TestSeriesFactory.series("LIN", TestSeriesFactory.linearCloses(300, 100.0, 0.5)));
        when(marketData.fetchPriceHistory(eq("SHORT"), anyString()))
                .thenReturn(TestSeriesFactory.series("SHORT", TestSeriesFactory.linearCloses(150, 10.0, 0.1)));

        ModelHandle handle = mock(ModelHandle.class);
        when(handle.architecture()).thenReturn(Architecture.RNN);
        flaky = mock(ModelAdapter.class);
        when(flaky.architecture()).thenReturn(Architecture.RNN);
        when(flaky.fit(any(), any(), any()))
                .thenReturn(handle)
                .thenThrow(new IllegalStateException("loss became NaN"))
                .thenReturn(handle);
        when(flaky.predict(any(), any())).thenAnswer(invocation -> {
            List<Window> windows = invocation.getArgument(1);
            double[] predicted = new double[windows.size()];
            for (int i = 0; i < predicted.length; i++) {
                predicted[i] = windows.get(i).last();
            }
            return predicted;
        });

        ModelAdapterRegistry adapters = new ModelAdapterRegistry(List.of(
                new ZeroShotAdapter(new NetworkTrainer(), properties), flaky));
        brain = new AutoLearningBrain(new TrainingRunLog(InMemoryTrainingRuns.repository()), properties);
        backtester = new WalkForwardBacktester(marketData, new SequencePreprocessor(), adapters, new MetricsEngine(),
                brain, properties);
    }

    @Test
    void rollingSplitsSlideAFixedTrainingSpan() {
        List<WalkForwardSplit> splits = new WalkForwardPlan(WalkForwardPlan.Strategy.ROLLING, 100, 20, 10).splits(150);

        assertThat(splits).hasSize(4);
        assertThat(splits.get(0)).isEqualTo(new WalkForwardSplit(0, 0, 100, 100, 120));
        assertThat(splits.get(3)).isEqualTo(new WalkForwardSplit(3, 30, 130, 130, 150));
        assertThat(splits).allSatisfy(split -> assertThat(split.trainWindows()).isEqualTo(100));
    }

    @Test
    void expandingSplitsKeepTheFirstWindowAndGrow() {
        List<WalkForwardSplit> splits = new WalkForwardPlan(WalkForwardPlan.Strategy.EXPANDING, 100, 20, 15).splits(150);

        assertThat(splits).extracting(WalkForwardSplit::trainStart).containsOnly(0);
        assertThat(splits).extracting(WalkForwardSplit::trainEnd).containsExactly(100, 115, 130);
        assertThat(splits.get(2).testEnd()).isEqualTo(150);
    }

    @Test
    void nonPositiveSizesAreRejected() {
        assertThatThrownBy(() -> new WalkForwardPlan(WalkForwardPlan.Strategy.ROLLING, 100, 0, 10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new WalkForwardPlan(null, 100, 20, 10))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void trendFollowerScoresEverySplitOfALinearSeries() {
        WalkForwardReport report = backtester.backtest("LIN", Architecture.ZERO_SHOT, null, null);

        assertThat(report.plan()).isEqualTo(new WalkForwardPlan(WalkForwardPlan.Strategy.ROLLING, 100, 20, 10));
        assertThat(report.totalSplits()).isEqualTo(13);
        assertThat(report.failedSplits()).isZero();
        assertThat(report.splits()).allSatisfy(outcome -> {
            assertThat(outcome.succeeded()).isTrue();
            assertThat(outcome.metrics().sampleCount()).isEqualTo(20);
            assertThat(outcome.metrics().rmse()).isCloseTo(0.0, within(1e-6));
        });
        assertThat(report.aggregate().sampleCount()).isEqualTo(260);
        assertThat(report.aggregate().toleranceAccuracy()).isEqualTo(100.0);
        assertThat(report.summary()).containsKeys("rmse", "mae", "mase", "smape", "toleranceAccuracy");
        assertThat(report.summary().get("rmse").validRuns()).isEqualTo(13);
    }

    @Test
    void failedSplitBecomesAnErrorRowAndIsLeftOutOfTheAggregate() {
        WalkForwardPlan plan = new WalkForwardPlan(WalkForwardPlan.Strategy.EXPANDING, 100, 20, 40);

        WalkForwardReport report = backtester.backtest("LIN", Architecture.RNN, null, plan);

        assertThat(report.totalSplits()).isEqualTo(4);
        assertThat(report.failedSplits()).isEqualTo(1);
        SplitOutcome failed = report.splits().get(1);
        assertThat(failed.succeeded()).isFalse();
        assertThat(failed.error()).isEqualTo("loss became NaN");
        assertThat(failed.metrics()).isNull();
        assertThat(report.aggregate().sampleCount()).isEqualTo(60);
        assertThat(report.summary().get("rmse").validRuns()).isEqualTo(3);
    }

    @Test
    void historyShorterThanOneSplitIsInsufficient() {
        assertThatThrownBy(() -> backtester.backtest("SHORT", Architecture.ZERO_SHOT, null, null))
                .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void hyperparametersForAnotherArchitectureAreRejected() {
        assertThatThrownBy(() -> backtester.backtest("LIN", Architecture.ZERO_SHOT,
                brain.defaults(Architecture.LSTM), null))
                .isInstanceOf(BadRequestException.class);
    }
}
