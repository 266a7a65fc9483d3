package com.drawforecast.common.exception;

/**
 * Failure inside one step of a training pass. Caught by
 * {@link com.drawforecast.common.training.ModelTrainer}; never reaches the prediction path.
 */
public class TrainingException extends ForecastException {

    public TrainingException(String step, String message, Throwable cause) {
        super(step, message, cause);
    }
}
