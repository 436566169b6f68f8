package com.admissions.prediction.prediction;

import com.admissions.prediction.config.ModelProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * LinearModelPredictionAdapter - Evaluates an exported linear regression in process.
 *
 * The model was fitted on standard-scaled features, so each raw value is
 * scaled with the training mean and standard deviation before weighting:
 * <pre>
 * prediction = intercept + sum( coefficient[f] * (x[f] - mean[f]) / scale[f] )
 * </pre>
 *
 * All seven features need a coefficient, a mean and a positive scale in
 * {@code model.linear}; anything missing fails startup.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "model", name = "mode", havingValue = "linear", matchIfMissing = true)
public class LinearModelPredictionAdapter implements PredictionAdapter {

    private final double intercept;
    private final double[] coefficients;
    private final double[] means;
    private final double[] scales;

    public LinearModelPredictionAdapter(ModelProperties properties) {
        ModelProperties.Linear linear = properties.getLinear();
        int size = FeatureRecord.FEATURE_NAMES.size();
        this.intercept = linear.getIntercept();
        this.coefficients = new double[size];
        this.means = new double[size];
        this.scales = new double[size];
        for (int i = 0; i < size; i++) {
            String feature = FeatureRecord.FEATURE_NAMES.get(i);
            coefficients[i] = required(linear.getCoefficients(), "coefficients", feature);
            means[i] = required(linear.getMeans(), "means", feature);
            scales[i] = required(linear.getScales(), "scales", feature);
            if (!(scales[i] > 0)) {
                throw new IllegalStateException("model.linear.scales." + feature + " must be positive");
            }
        }
        log.info("Linear model loaded: intercept={}, features={}", intercept, FeatureRecord.FEATURE_NAMES);
    }

    /**
     * Standardize each feature with its training mean and scale, then apply
     * the regression weights.
     */
    @Override
    public double run(FeatureRecord record) {
        Map<String, Double> features = record.toFeatureMap();
        double prediction = intercept;
        for (int i = 0; i < coefficients.length; i++) {
            double x = features.get(FeatureRecord.FEATURE_NAMES.get(i));
            prediction += coefficients[i] * (x - means[i]) / scales[i];
        }
        return prediction;
    }

    private static double required(Map<String, Double> values, String group, String feature) {
        Double value = values.get(feature);
        if (value == null || !Double.isFinite(value)) {
            throw new IllegalStateException("model.linear." + group + "." + feature + " must be configured");
        }
        return value;
    }
}
