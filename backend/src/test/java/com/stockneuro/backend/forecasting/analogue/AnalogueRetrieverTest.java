package com.stockneuro.backend.forecasting.analogue;

import com.stockneuro.backend.config.ForecastingProperties;
import com.stockneuro.backend.util.TestSeriesFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class AnalogueRetrieverTest {

    private AnalogueRetriever retriever;

    @BeforeEach
    void setUp() {
        retriever = new AnalogueRetriever(new ForecastingProperties());
    }

    @Test
    void indexesStridedWindowsOnce() {
        double[] closes = TestSeriesFactory.randomWalk(100, 50.0, 1L);
        List<LocalDate> dates = TestSeriesFactory.tradingDates(100);

        assertThat(retriever.index("ACME", dates, closes)).isEqualTo(14);
        assertThat(retriever.index("ACME", dates, closes)).isZero();
        assertThat(retriever.size()).isEqualTo(14);
    }

    @Test
    void emptyIndexReturnsNoMatches() {
        assertThat(retriever.retrieve("q", TestSeriesFactory.randomWalk(30, 10.0, 2L), 5)).isEmpty();
    }

    @Test
    void identicalShapeRanksFirstWithFullSimilarity() {
        double[] closes = TestSeriesFactory.randomWalk(200, 80.0, 3L);
        retriever.index("ACME", TestSeriesFactory.tradingDates(200), closes);
        double[] query = Arrays.copyOfRange(closes, 60, 90);

        List<AnalogueMatch> matches = retriever.retrieve("query-1", query, 5);

        assertThat(matches).hasSize(5);
        assertThat(matches.get(0).similarity()).isEqualTo(1.0);
        assertThat(matches.get(0).endDate()).isEqualTo(TestSeriesFactory.tradingDates(200).get(89));
        assertThat(matches).extracting(AnalogueMatch::similarity)
                .allSatisfy(similarity -> assertThat(similarity).isBetween(0.0, 1.0))
                .isSortedAccordingTo((a, b) -> Double.compare(b, a));
        assertThat(matches).extracting(AnalogueMatch::queryWindowId).containsOnly("query-1");
    }

    @Test
    void excludesTheQueryWindowItself() {
        double[] closes = TestSeriesFactory.randomWalk(120, 30.0, 4L);
        List<LocalDate> dates = TestSeriesFactory.tradingDates(120);
        retriever.index("ACME", dates, closes);
        String selfId = "ACME@" + dates.get(59);

        List<AnalogueMatch> matches = retriever.retrieve(selfId, Arrays.copyOfRange(closes, 30, 60), 50);

        assertThat(matches).extracting(AnalogueMatch::segmentId).doesNotContain(selfId);
        assertThat(matches).hasSize(retriever.size() - 1);
    }

    @Test
    void realizedReturnDescribesTheNextClose() {
        double[] closes = TestSeriesFactory.linearCloses(40, 100.0, 1.0);
        retriever.index("LIN", TestSeriesFactory.tradingDates(40), closes);

        List<AnalogueMatch> matches = retriever.retrieve("q", Arrays.copyOfRange(closes, 0, 30), 1);

        assertThat(matches.get(0).realizedReturn()).isEqualTo((130.0 - 129.0) / 129.0);
    }

    @Test
    void readersSeeConsistentSnapshotsWhileIndexing() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        double[] query = TestSeriesFactory.randomWalk(30, 20.0, 9L);
        Future<?> writer = pool.submit(() -> {
            for (int i = 0; i < 20; i++) {
                retriever.index("T" + i, TestSeriesFactory.tradingDates(80), TestSeriesFactory.randomWalk(80, 20.0, i));
            }
        });
        Future<?> reader = pool.submit(() -> {
            for (int i = 0; i < 200; i++) {
                List<AnalogueMatch> matches = retriever.retrieve("q", query, 5);
                assertThat(matches.size()).isLessThanOrEqualTo(5);
            }
        });
        writer.get(30, TimeUnit.SECONDS);
        reader.get(30, TimeUnit.SECONDS);
        pool.shutdown();

        assertThat(retriever.size()).isEqualTo(20 * 10);
    }
}
