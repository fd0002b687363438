package tw.gc.strategy.validation.services.walkforward;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of training on one window.
 *
 * @param parameters the chosen parameter values, keyed by parameter name
 * @param criterion in-sample criterion achieved by those parameters
 * @param finalPosition position held at the last training bar, handed to the evaluator so the
 *                      first test decision continues from it
 */
public record TrainingResult(Map<String, Double> parameters, double criterion, int finalPosition) {

    public TrainingResult {
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }
}
