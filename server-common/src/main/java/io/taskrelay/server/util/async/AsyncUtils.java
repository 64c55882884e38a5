package io.taskrelay.server.util.async;

import mutiny.zero.BackpressureStrategy;
import mutiny.zero.TubeConfiguration;

public class AsyncUtils {

    public static final int TUBE_BUFFER_SIZE = 256;

    private AsyncUtils() {
    }

    /**
     * The tube configuration shared by every publisher handed out to transports.
     * Items are buffered rather than dropped when the subscriber has no outstanding demand.
     */
    public static TubeConfiguration createTubeConfig() {
        return new TubeConfiguration()
                .withBackpressureStrategy(BackpressureStrategy.BUFFER)
                .withBufferSize(TUBE_BUFFER_SIZE);
    }
}
