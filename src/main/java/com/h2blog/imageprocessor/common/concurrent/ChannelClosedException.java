package com.h2blog.imageprocessor.common.concurrent;

import java.io.Serial;

/**
 * Thrown when sending into a {@link BoundedChannel} that has been closed.
 */
public class ChannelClosedException extends IllegalStateException {
    @Serial
    private static final long serialVersionUID = -2215873012930841706L;

    public ChannelClosedException(String channelName) {
        super("Channel '" + channelName + "' is closed.");
    }
}
