package tw.gc.strategy.validation.enums;

/**
 * What an out-of-sample evaluator emits as its return stream.
 */
public enum ReturnType {
    /** One return per bar, zero while flat */
    ALL_BARS,
    /** One return per bar with a non-flat position */
    OPEN_POSITION,
    /** One return per closed trade; an open trade is force-closed at the end of the window */
    COMPLETED_TRADES
}
