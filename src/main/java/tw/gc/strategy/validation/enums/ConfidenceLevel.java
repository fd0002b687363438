package tw.gc.strategy.validation.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The three one-sided tail masses every confidence bound is reported at.
 */
@Getter
@RequiredArgsConstructor
public enum ConfidenceLevel {
    TWO_POINT_FIVE(0.025),
    FIVE(0.05),
    TEN(0.10);

    private final double tailMass;
}
