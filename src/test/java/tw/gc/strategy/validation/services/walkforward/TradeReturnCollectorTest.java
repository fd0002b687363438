package tw.gc.strategy.validation.services.walkforward;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tw.gc.strategy.validation.enums.ReturnType;

import static org.assertj.core.api.Assertions.*;

class TradeReturnCollectorTest {

    /** long, flat, short over prices 1 -> 2 -> 3 -> 2.5 */
    private static void feedMixedPositions(TradeReturnCollector collector) {
        collector.onBar(1, 1.0, 2.0, false);
        collector.onBar(0, 2.0, 3.0, false);
        collector.onBar(-1, 3.0, 2.5, true);
    }

    @Nested
    @DisplayName("All bars")
    class AllBarsTests {

        @Test
        @DisplayName("should record one return per bar, flat bars included")
        void everyBar() {
            var collector = new TradeReturnCollector(ReturnType.ALL_BARS);

            feedMixedPositions(collector);

            assertThat(collector.returns()).containsExactly(1.0, 0.0, 0.5);
            assertThat(collector.position()).isEqualTo(-1);
        }
    }

    @Nested
    @DisplayName("Open position")
    class OpenPositionTests {

        @Test
        @DisplayName("should skip flat bars")
        void skipFlat() {
            var collector = new TradeReturnCollector(ReturnType.OPEN_POSITION);

            feedMixedPositions(collector);

            assertThat(collector.returns()).containsExactly(1.0, 0.5);
            assertThat(collector.size()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Completed trades")
    class CompletedTradeTests {

        @Test
        @DisplayName("should record one return per round trip")
        void roundTrips() {
            var collector = new TradeReturnCollector(ReturnType.COMPLETED_TRADES);

            collector.onBar(1, 1.0, 2.0, false);
            collector.onBar(1, 2.0, 3.0, false);
            collector.onBar(0, 3.0, 4.0, false);
            collector.onBar(-1, 4.0, 3.5, true);

            // long 1 -> 3, then short 4 -> 3.5 force-closed on the last bar
            assertThat(collector.returns()).containsExactly(2.0, 0.5);
        }

        @Test
        @DisplayName("a reversal should close one trade and open the next at the same price")
        void reversal() {
            var collector = new TradeReturnCollector(ReturnType.COMPLETED_TRADES);

            collector.onBar(1, 10.0, 11.0, false);
            collector.onBar(-1, 12.0, 11.0, false);
            collector.onBar(0, 9.0, 9.5, true);

            assertThat(collector.returns()).containsExactly(2.0, 3.0);
            assertThat(collector.position()).isZero();
        }

        @Test
        @DisplayName("a trade opened on the last bar should still be closed")
        void openedOnLastBar() {
            var collector = new TradeReturnCollector(ReturnType.COMPLETED_TRADES);

            collector.onBar(0, 5.0, 5.5, false);
            collector.onBar(1, 5.5, 6.5, true);

            assertThat(collector.returns()).containsExactly(1.0);
        }

        @Test
        @DisplayName("flat throughout should record nothing")
        void flatThroughout() {
            var collector = new TradeReturnCollector(ReturnType.COMPLETED_TRADES);

            collector.onBar(0, 1.0, 2.0, false);
            collector.onBar(0, 2.0, 3.0, true);

            assertThat(collector.returns()).isEmpty();
        }
    }

    @Test
    @DisplayName("should grow past its initial capacity")
    void growsBuffer() {
        var collector = new TradeReturnCollector(ReturnType.ALL_BARS);

        for (int i = 0; i < 100; i++) {
            collector.onBar(1, i, i + 1, i == 99);
        }

        assertThat(collector.size()).isEqualTo(100);
        assertThat(collector.toEvaluationResult().returns()).hasSize(100).containsOnly(1.0);
        assertThat(collector.toEvaluationResult().finalPosition()).isEqualTo(1);
    }
}
