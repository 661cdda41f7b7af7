package com.airsentinel.service.error;

import com.airsentinel.core.error.AirSentinelException;

public class ModelNotTrainedException extends AirSentinelException {
    public ModelNotTrainedException(String city) {
        super("model_not_trained", "No model found for " + city + ". Train models first.");
    }
}
