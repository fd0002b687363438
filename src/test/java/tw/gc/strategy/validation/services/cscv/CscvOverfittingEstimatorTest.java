package tw.gc.strategy.validation.services.cscv;

import java.util.Arrays;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import tw.gc.strategy.validation.config.ValidationProperties;
import tw.gc.strategy.validation.enums.PerformanceCriterion;
import tw.gc.strategy.validation.exceptions.ValidationConfigurationException;
import tw.gc.strategy.validation.services.concurrent.ReplicationExecutor;
import tw.gc.strategy.validation.testutil.MovingAverageReturnsMatrix;
import tw.gc.strategy.validation.testutil.SyntheticSeriesFactory;

import static org.assertj.core.api.Assertions.*;

class CscvOverfittingEstimatorTest {

    private ValidationProperties properties;
    private CscvOverfittingEstimator estimator;

    @BeforeEach
    void setUp() {
        properties = new ValidationProperties();
        estimator = new CscvOverfittingEstimator(properties, ReplicationExecutor.sequential());
    }

    @Nested
    @DisplayName("Known outcomes")
    class KnownOutcomeTests {

        @Test
        @DisplayName("systems that flip between halves should be fully overfit")
        void mirroredSystems() {
            // system 0 wins case 0, system 1 wins case 1
            double[] returns = {1.0, -1.0, -1.0, 1.0};

            CscvResult result = estimator.analyze(returns, 2, 2, 2, PerformanceCriterion.MEAN_RETURN);

            assertThat(result.combinations()).isEqualTo(2);
            assertThat(result.votes()).isEqualTo(2);
            assertThat(result.probability()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("a system that dominates every case should never look overfit")
        void dominantSystem() {
            int nSystems = 5;
            int nCases = 40;
            double[] returns = new double[nSystems * nCases];
            for (int system = 0; system < nSystems; system++) {
                for (int c = 0; c < nCases; c++) {
                    returns[system * nCases + c] = system == 3 ? 1.0 + 0.01 * (c % 7) : 0.01 * ((c + system) % 5);
                }
            }

            double probability = estimator.cscvProbability(returns, nSystems, nCases, 8, PerformanceCriterion.MEAN_RETURN);

            assertThat(probability).isZero();
        }

        @ParameterizedTest
        @EnumSource(PerformanceCriterion.class)
        @DisplayName("identical systems should never vote, giving exactly zero")
        void identicalEntries(PerformanceCriterion criterion) {
            double[] returns = new double[6 * 30];
            Arrays.fill(returns, 0.02);

            CscvResult result = estimator.analyze(returns, 6, 30, 6, criterion);

            assertThat(result.probability()).isZero();
            assertThat(result.votes()).isZero();
            assertThat(result.combinations()).isEqualTo(20);
            assertThat(estimator.analyze(returns, 6, 30, 6, criterion)).usingRecursiveComparison()
                .isEqualTo(result);
        }
    }

    @Nested
    @DisplayName("Moving-average systems")
    class MovingAverageTests {

        @Test
        @DisplayName("noise prices should give a probability in [0, 1] over every split")
        void noisePrices() {
            double[] prices = SyntheticSeriesFactory.randomWalk(2024L, 500, 0.0, 0.01);
            var matrix = MovingAverageReturnsMatrix.build(prices, 10);

            CscvResult result = estimator.analyze(
                matrix.returns(), matrix.nSystems(), matrix.nCases(), 10, PerformanceCriterion.MEAN_RETURN);

            assertThat(matrix.nSystems()).isEqualTo(45);
            assertThat(result.combinations()).isEqualTo(252);
            assertThat(result.probability()).isBetween(0.0, 1.0);
            assertThat(result.blockLengths()).hasSize(10);
            assertThat(Arrays.stream(result.blockLengths()).sum()).isEqualTo(matrix.nCases());
        }

        @Test
        @DisplayName("parallel evaluation should match sequential evaluation")
        void parallelMatchesSequential() {
            double[] prices = SyntheticSeriesFactory.randomWalk(11L, 400, 0.0, 0.01);
            var matrix = MovingAverageReturnsMatrix.build(prices, 8);
            var executor = new ReplicationExecutor(4);
            try {
                var parallel = new CscvOverfittingEstimator(properties, executor);

                CscvResult expected = estimator.analyze(
                    matrix.returns(), matrix.nSystems(), matrix.nCases(), 10, PerformanceCriterion.PROFIT_FACTOR);
                CscvResult actual = parallel.analyze(
                    matrix.returns(), matrix.nSystems(), matrix.nCases(), 10, PerformanceCriterion.PROFIT_FACTOR);

                assertThat(actual.votes()).isEqualTo(expected.votes());
                assertThat(actual.probability()).isEqualTo(expected.probability());
            } finally {
                executor.shutdown();
            }
        }

        @Test
        @DisplayName("short overload should use the configured block count")
        void configuredBlocks() {
            properties.getCscv().setBlocks(4);
            double[] prices = SyntheticSeriesFactory.randomWalk(12L, 200, 0.0, 0.01);
            var matrix = MovingAverageReturnsMatrix.build(prices, 5);

            double configured = estimator.cscvProbability(
                matrix.returns(), matrix.nSystems(), matrix.nCases(), PerformanceCriterion.MEAN_RETURN);

            assertThat(configured).isEqualTo(estimator.cscvProbability(
                matrix.returns(), matrix.nSystems(), matrix.nCases(), 4, PerformanceCriterion.MEAN_RETURN));
        }

        @Test
        @DisplayName("grand best criterion should be the best full-sample row")
        void grandBest() {
            double[] returns = {1.0, 1.0, 3.0, 3.0, 2.0, 2.0};

            assertThat(estimator.grandBestCriterion(returns, 3, 2, PerformanceCriterion.MEAN_RETURN)).isEqualTo(3.0);
        }
    }

    @Nested
    @DisplayName("Block normalization")
    class BlockNormalizationTests {

        private ListAppender<ILoggingEvent> logAppender;
        private Logger logger;

        @BeforeEach
        void attachAppender() {
            logger = (Logger) LoggerFactory.getLogger(CscvOverfittingEstimator.class);
            logAppender = new ListAppender<>();
            logAppender.start();
            logger.addAppender(logAppender);
        }

        @AfterEach
        void detachAppender() {
            logger.detachAppender(logAppender);
        }

        @Test
        @DisplayName("odd block counts should be rounded down with a warning")
        void oddBlocksRoundedDown() {
            double[] returns = new double[3 * 20];
            for (int i = 0; i < returns.length; i++) {
                returns[i] = Math.sin(i);
            }

            CscvResult odd = estimator.analyze(returns, 3, 20, 7, PerformanceCriterion.MEAN_RETURN);
            CscvResult even = estimator.analyze(returns, 3, 20, 6, PerformanceCriterion.MEAN_RETURN);

            assertThat(odd.effectiveBlocks()).isEqualTo(6);
            assertThat(odd.probability()).isEqualTo(even.probability());
            assertThat(logAppender.list)
                .filteredOn(event -> event.getLevel() == Level.WARN)
                .singleElement()
                .satisfies(event -> assertThat(event.getFormattedMessage()).contains("nBlocks 7 is odd"));
        }

        @Test
        @DisplayName("a single block should be rejected")
        void singleBlock() {
            assertThatThrownBy(() -> estimator.analyze(new double[10], 1, 10, 1, PerformanceCriterion.MEAN_RETURN))
                .isInstanceOf(ValidationConfigurationException.class)
                .hasMessageContaining("nBlocks");
        }
    }

    @Nested
    @DisplayName("Configuration errors")
    class ConfigurationTests {

        @Test
        @DisplayName("should reject a matrix that does not match its dimensions")
        void rejectShapeMismatch() {
            assertThatThrownBy(() -> estimator.analyze(new double[10], 3, 4, 2, PerformanceCriterion.MEAN_RETURN))
                .isInstanceOf(ValidationConfigurationException.class)
                .hasMessageContaining("3 x 4");
        }

        @Test
        @DisplayName("should reject more blocks than cases")
        void rejectTooManyBlocks() {
            assertThatThrownBy(() -> estimator.analyze(new double[8], 2, 4, 6, PerformanceCriterion.MEAN_RETURN))
                .isInstanceOf(ValidationConfigurationException.class)
                .hasMessageContaining("nCases");
        }

        @Test
        @DisplayName("should reject zero systems")
        void rejectZeroSystems() {
            assertThatThrownBy(() -> estimator.analyze(new double[0], 0, 4, 2, PerformanceCriterion.MEAN_RETURN))
                .isInstanceOf(ValidationConfigurationException.class)
                .hasMessageContaining("nSystems");
        }
    }
}
