package com.callexchange.fraud.risk.signal.classifier;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Body returned by the model-serving endpoint.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClassifierResponse {

    private Double fraudProbability;
    private Double confidence;
    private Map<String, Double> featureWeights;
    private List<String> explanations;
}
