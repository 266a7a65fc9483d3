package com.drawforecast.common.training;

import com.drawforecast.common.analysis.MarketStateAnalyzer;
import com.drawforecast.common.context.ForecastContext;
import com.drawforecast.common.context.ForecastSettings;
import com.drawforecast.common.model.MarketState;
import com.drawforecast.common.model.OutcomeRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.drawforecast.common.OutcomeFixtures.OBSERVED_AT;
import static com.drawforecast.common.OutcomeFixtures.arrivalOrder;
import static com.drawforecast.common.OutcomeFixtures.newestFirst;
import static com.drawforecast.common.OutcomeFixtures.repeat;
import static org.junit.jupiter.api.Assertions.*;

class ModelTrainerTest {

    private static final Clock CLOCK = Clock.fixed(OBSERVED_AT, ZoneOffset.UTC);

    @Nested
    @DisplayName("table builders")
    class TableBuilders {

        @Test
        @DisplayName("pattern follower is the record just past the window")
        void patternFollowers() {
            OccurrenceTable table = ModelTrainer.buildPatternTable(newestFirst("12312312"), List.of(3));

            OccurrenceTable.Counts counts = table.lookup("123").orElseThrow();
            assertEquals(2, counts.total());
            assertEquals(2, counts.count(1));
            assertEquals(3, table.size());
        }

        @Test
        @DisplayName("markov table holds every order up to the maximum")
        void markovOrders() {
            OccurrenceTable table = ModelTrainer.buildMarkovTable(newestFirst("55555"), 3);

            assertEquals(2, table.lookup("5-5-5").orElseThrow().total());
            assertEquals(3, table.lookup("5-5").orElseThrow().total());
            assertEquals(4, table.lookup("5").orElseThrow().total());
        }

        @Test
        @DisplayName("a buffer no longer than the window yields no entries")
        void shortBuffer() {
            assertEquals(0, ModelTrainer.buildPatternTable(newestFirst("123"), List.of(3)).size());
        }
    }

    @Nested
    @DisplayName("run")
    class Run {

        @Test
        @DisplayName("publishes tables, windows and market state together")
        void publishesGeneration() {
            ForecastContext context = ForecastContext.withDefaults();
            context.buffer().ingest(arrivalOrder(repeat("72", 30)));
            ModelTrainer trainer = new ModelTrainer(context, new MarketStateAnalyzer(CLOCK), CLOCK);

            assertTrue(trainer.run());

            TrainedModels models = context.trainedModels();
            assertTrue(models.patterns().lookup("727").isPresent());
            assertTrue(models.markovChains().lookup("7-2").isPresent());
            assertEquals(10, models.trendWindows().shortTerm().size());
            assertEquals(OBSERVED_AT, models.trainedAt());
            assertEquals(OBSERVED_AT, context.marketState().lastUpdate());
            assertEquals(1, trainer.completedPasses());
            assertEquals(OBSERVED_AT, trainer.lastSuccess());
            assertFalse(trainer.isTraining());
        }

        @Test
        @DisplayName("each pass rebuilds from scratch and drops stale keys")
        void rebuildDropsStaleKeys() {
            ForecastSettings settings = new ForecastSettings(10, List.of(3), 3, ForecastSettings.defaultWeights(), 1L);
            ForecastContext context = new ForecastContext(settings);
            ModelTrainer trainer = new ModelTrainer(context, new MarketStateAnalyzer(CLOCK), CLOCK);

            context.buffer().ingest(batch("old", 1, 10));
            trainer.run();
            assertTrue(context.trainedModels().patterns().lookup("111").isPresent());

            context.buffer().ingest(batch("new", 2, 10));
            trainer.run();
            assertTrue(context.trainedModels().patterns().lookup("222").isPresent());
            assertFalse(context.trainedModels().patterns().lookup("111").isPresent());
        }

        @Test
        @DisplayName("a failing step keeps the previous generation")
        void failureKeepsPrevious() {
            ForecastContext context = ForecastContext.withDefaults();
            context.buffer().ingest(arrivalOrder(repeat("72", 30)));
            TrainedModels before = context.trainedModels();
            MarketState stateBefore = context.marketState();

            MarketStateAnalyzer failing = new MarketStateAnalyzer(CLOCK) {
                @Override
                public MarketState analyze(List<OutcomeRecord> records, MarketState previous) {
                    throw new IllegalStateException("analysis exploded");
                }
            };
            ModelTrainer trainer = new ModelTrainer(context, failing, CLOCK);

            assertFalse(trainer.run());
            assertSame(before, context.trainedModels());
            assertSame(stateBefore, context.marketState());
            assertFalse(trainer.isTraining());
            assertEquals(0, trainer.completedPasses());
            assertEquals(Instant.EPOCH, trainer.lastSuccess());
        }

        @Test
        @DisplayName("a trigger during a running pass is skipped")
        void singleFlight() throws Exception {
            ForecastContext context = ForecastContext.withDefaults();
            context.buffer().ingest(arrivalOrder(repeat("72", 30)));
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);

            MarketStateAnalyzer blocking = new MarketStateAnalyzer(CLOCK) {
                @Override
                public MarketState analyze(List<OutcomeRecord> records, MarketState previous) {
                    entered.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return super.analyze(records, previous);
                }
            };
            ModelTrainer trainer = new ModelTrainer(context, blocking, CLOCK);

            AtomicBoolean firstResult = new AtomicBoolean();
            Thread first = new Thread(() -> firstResult.set(trainer.run()));
            first.start();
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            assertTrue(trainer.isTraining());
            assertFalse(trainer.run());

            release.countDown();
            first.join(5_000);
            assertTrue(firstResult.get());
            assertEquals(1, trainer.completedPasses());
        }
    }

    private static List<OutcomeRecord> batch(String prefix, int digit, int count) {
        List<OutcomeRecord> records = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            records.add(OutcomeRecord.of(prefix + i, digit, OBSERVED_AT));
        }
        return records;
    }
}
