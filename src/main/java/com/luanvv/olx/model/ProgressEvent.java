package com.luanvv.olx.model;

import java.time.Instant;
import lombok.Value;

@Value
public class ProgressEvent {
    String message;
    Instant timestamp;

    public static ProgressEvent of(String message) {
        return new ProgressEvent(message, Instant.now());
    }
}
