package tw.gc.strategy.validation.services.walkforward;

import java.util.Arrays;
import java.util.Objects;

import tw.gc.strategy.validation.enums.ReturnType;

/**
 * Turns a bar-by-bar position stream into the return stream selected by a {@link ReturnType}.
 *
 * <p>Call {@link #onBar} once per decision bar, in order. The bar's return is
 * {@code position * (nextPrice - price)}: positions are +1 long, -1 short, 0 flat, and prices are
 * expected to be log prices so differences are log returns.
 *
 * <p>In {@link ReturnType#COMPLETED_TRADES} mode a trade opens at the price of the bar where the
 * position changes to non-flat and closes at the price of the bar where it changes again. A
 * position carried in from training counts as opened on the first bar. Whatever is still open
 * on the bar flagged {@code lastBar} is closed at that bar's next price.
 */
public class TradeReturnCollector {

    private final ReturnType returnType;
    private double[] returns = new double[16];
    private int count;
    private int priorPosition;
    private double openPrice;

    public TradeReturnCollector(ReturnType returnType) {
        this.returnType = Objects.requireNonNull(returnType, "returnType");
    }

    /**
     * Records one decision bar.
     *
     * @param position position held from this bar to the next, after this bar's decision
     * @param price price at the decision bar
     * @param nextPrice price at the following bar
     * @param lastBar true for the final decision bar of the window
     */
    public void onBar(int position, double price, double nextPrice, boolean lastBar) {
        double barReturn = position * (nextPrice - price);

        switch (returnType) {
            case ALL_BARS -> add(barReturn);
            case OPEN_POSITION -> {
                if (position != 0) {
                    add(barReturn);
                }
            }
            case COMPLETED_TRADES -> {
                if (position != priorPosition) {
                    if (priorPosition != 0) {
                        add(priorPosition * (price - openPrice));
                    }
                    if (position != 0) {
                        openPrice = price;
                    }
                }
                if (lastBar && position != 0) {
                    add(position * (nextPrice - openPrice));
                }
            }
        }

        priorPosition = position;
    }

    /**
     * @return the position after the most recent bar
     */
    public int position() {
        return priorPosition;
    }

    public int size() {
        return count;
    }

    public double[] returns() {
        return Arrays.copyOf(returns, count);
    }

    public EvaluationResult toEvaluationResult() {
        return new EvaluationResult(returns(), priorPosition);
    }

    private void add(double value) {
        if (count == returns.length) {
            returns = Arrays.copyOf(returns, count * 2);
        }
        returns[count++] = value;
    }
}
