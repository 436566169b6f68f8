package com.admissions.prediction.prediction;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * FeatureRecord - Applicant profile submitted to POST /predict.
 *
 * Every field is required and range-checked by Bean Validation before the
 * predictor sees it. JSON names follow the dataset columns:
 * <pre>
 * {
 *   "GRE_Score": 337,
 *   "TOEFL_Score": 118,
 *   "University_Rating": 4,
 *   "SOP": 4.5,
 *   "LOR": 4.5,
 *   "CGPA": 9.65,
 *   "Research": 1
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeatureRecord {

    public static final String GRE_SCORE = "GRE_Score";
    public static final String TOEFL_SCORE = "TOEFL_Score";
    public static final String UNIVERSITY_RATING = "University_Rating";
    public static final String SOP = "SOP";
    public static final String LOR = "LOR";
    public static final String CGPA = "CGPA";
    public static final String RESEARCH = "Research";

    /** Wire names in model column order. */
    public static final List<String> FEATURE_NAMES =
            List.of(GRE_SCORE, TOEFL_SCORE, UNIVERSITY_RATING, SOP, LOR, CGPA, RESEARCH);

    private static final Map<String, String> WIRE_NAMES = Map.of(
            "greScore", GRE_SCORE,
            "toeflScore", TOEFL_SCORE,
            "universityRating", UNIVERSITY_RATING,
            "sop", SOP,
            "lor", LOR,
            "cgpa", CGPA,
            "research", RESEARCH);

    @NotNull(message = "GRE_Score is required")
    @Min(value = 0, message = "GRE_Score must be between 0 and 340")
    @Max(value = 340, message = "GRE_Score must be between 0 and 340")
    @JsonProperty(GRE_SCORE)
    private Integer greScore;

    @NotNull(message = "TOEFL_Score is required")
    @Min(value = 0, message = "TOEFL_Score must be between 0 and 120")
    @Max(value = 120, message = "TOEFL_Score must be between 0 and 120")
    @JsonProperty(TOEFL_SCORE)
    private Integer toeflScore;

    @NotNull(message = "University_Rating is required")
    @Min(value = 1, message = "University_Rating must be between 1 and 5")
    @Max(value = 5, message = "University_Rating must be between 1 and 5")
    @JsonProperty(UNIVERSITY_RATING)
    private Integer universityRating;

    @NotNull(message = "SOP is required")
    @DecimalMin(value = "1", message = "SOP must be between 1 and 5")
    @DecimalMax(value = "5", message = "SOP must be between 1 and 5")
    @JsonProperty(SOP)
    private Double sop;

    @NotNull(message = "LOR is required")
    @DecimalMin(value = "1", message = "LOR must be between 1 and 5")
    @DecimalMax(value = "5", message = "LOR must be between 1 and 5")
    @JsonProperty(LOR)
    private Double lor;

    @NotNull(message = "CGPA is required")
    @DecimalMin(value = "0", message = "CGPA must be between 0 and 10")
    @DecimalMax(value = "10", message = "CGPA must be between 0 and 10")
    @JsonProperty(CGPA)
    private Double cgpa;

    @NotNull(message = "Research is required")
    @Min(value = 0, message = "Research must be 0 or 1")
    @Max(value = 1, message = "Research must be 0 or 1")
    @JsonProperty(RESEARCH)
    private Integer research;

    /**
     * @return feature values keyed by wire name, in {@link #FEATURE_NAMES} order
     */
    public Map<String, Double> toFeatureMap() {
        Map<String, Double> features = new LinkedHashMap<>();
        features.put(GRE_SCORE, greScore.doubleValue());
        features.put(TOEFL_SCORE, toeflScore.doubleValue());
        features.put(UNIVERSITY_RATING, universityRating.doubleValue());
        features.put(SOP, sop);
        features.put(LOR, lor);
        features.put(CGPA, cgpa);
        features.put(RESEARCH, research.doubleValue());
        return features;
    }

    /**
     * Translate a Java property path from a validation error into its JSON name.
     */
    public static String wireName(String property) {
        return WIRE_NAMES.getOrDefault(property, property);
    }
}
