package tw.gc.strategy.validation.enums;

import tw.gc.strategy.validation.services.stats.SampleStatistic;

/**
 * Performance criteria a trading system can be optimized or judged on.
 *
 * <p>Pick the constant once where the caller's choice enters the engine and pass it around as a
 * {@link SampleStatistic}; nothing downstream switches on it again.
 */
public enum PerformanceCriterion implements SampleStatistic {

    MEAN_RETURN {
        @Override
        public double apply(double[] sample) {
            double sum = 0.0;
            boolean constant = true;
            for (double value : sample) {
                sum += value;
                constant &= value == sample[0];
            }
            // sum / n drifts for constants like 0.1; a constant sample's mean is the constant itself
            if (constant && sample.length > 0) {
                return sample[0];
            }
            return sum / (sample.length + COUNT_FLOOR);
        }
    },

    PROFIT_FACTOR {
        @Override
        public double apply(double[] sample) {
            double winSum = SUM_FLOOR;
            double loseSum = SUM_FLOOR;
            for (double value : sample) {
                if (value > 0.0) {
                    winSum += value;
                } else if (value < 0.0) {
                    loseSum -= value;
                }
            }
            return winSum / loseSum;
        }
    },

    SHARPE_RATIO {
        @Override
        public double apply(double[] sample) {
            double sum = 0.0;
            double sumSquares = 0.0;
            for (double value : sample) {
                sum += value;
                sumSquares += value * value;
            }
            double mean = sum / (sample.length + COUNT_FLOOR);
            double variance = sumSquares / (sample.length + COUNT_FLOOR) - mean * mean;
            if (variance < VARIANCE_FLOOR) {
                variance = VARIANCE_FLOOR;
            }
            return mean / Math.sqrt(variance);
        }
    };

    private static final double COUNT_FLOOR = 1.0e-30;
    private static final double SUM_FLOOR = 1.0e-60;
    private static final double VARIANCE_FLOOR = 1.0e-20;

    /**
     * Maps the legacy integer selector (0 = mean return, 1 = profit factor, 2 = Sharpe ratio).
     *
     * @throws IllegalArgumentException for any other code
     */
    public static PerformanceCriterion fromCode(int code) {
        return switch (code) {
            case 0 -> MEAN_RETURN;
            case 1 -> PROFIT_FACTOR;
            case 2 -> SHARPE_RATIO;
            default -> throw new IllegalArgumentException("Unknown criterion code: " + code);
        };
    }
}
