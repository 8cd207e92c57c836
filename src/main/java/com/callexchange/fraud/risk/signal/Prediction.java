package com.callexchange.fraud.risk.signal;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class Prediction {

    /** 0.0–1.0 probability that the entity is fraudulent. */
    double fraudProbability;
    /** 0.0–1.0 confidence of the model in its own answer. */
    double confidence;
    Map<String, Double> featureWeights;
    List<String> explanations;
}
