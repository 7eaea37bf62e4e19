package com.spotprice.simulator.domain.service.timeline;

public class TimelineGenerationException extends RuntimeException {

    public TimelineGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
