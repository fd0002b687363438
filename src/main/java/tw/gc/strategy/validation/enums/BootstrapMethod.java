package tw.gc.strategy.validation.enums;

/**
 * Bootstrap confidence-interval construction methods.
 */
public enum BootstrapMethod {
    /** Bounds read directly from the sorted bootstrap distribution */
    PERCENTILE,
    /** Bias-corrected and accelerated percentile */
    BCA,
    /** Percentile bounds reflected around the point estimate */
    PIVOT
}
