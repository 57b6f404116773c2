package com.luanvv.olx.core;

import com.luanvv.olx.model.ProgressEvent;
import java.util.function.Consumer;

@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = event -> { };

    void onProgress(ProgressEvent event);

    static ProgressListener of(Consumer<String> messages) {
        return messages == null ? NONE : event -> messages.accept(event.getMessage());
    }
}
