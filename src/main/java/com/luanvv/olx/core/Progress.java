package com.luanvv.olx.core;

import com.luanvv.olx.model.ProgressEvent;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public final class Progress {
    private final ProgressListener listener;

    public Progress(ProgressListener listener) {
        this.listener = listener == null ? ProgressListener.NONE : listener;
    }

    public void report(String message) {
        log.info(message);
        try {
            listener.onProgress(ProgressEvent.of(message));
        } catch (RuntimeException e) {
            log.warn("Progress listener failed on '{}': {}", message, e.toString());
        }
    }

    public void report(String format, Object... args) {
        report(String.format(format, args));
    }
}
