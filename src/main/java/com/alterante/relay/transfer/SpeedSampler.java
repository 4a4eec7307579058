package com.alterante.relay.transfer;

import com.alterante.relay.queue.EventLoop;

import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Samples the speed of each leg every {@link #PERIOD_MS} on the event loop.
 */
public class SpeedSampler implements AutoCloseable {

    public static final long PERIOD_MS = 500;

    private final EventLoop loop;
    private final List<TransferLeg> legs;
    private ScheduledFuture<?> task;

    public SpeedSampler(EventLoop loop, List<TransferLeg> legs) {
        this.loop = loop;
        this.legs = List.copyOf(legs);
    }

    public synchronized void start() {
        if (task == null) {
            task = loop.scheduleAtFixedRate(this::sample, PERIOD_MS, PERIOD_MS);
        }
    }

    private void sample() {
        for (TransferLeg leg : legs) {
            leg.sampleSpeed(PERIOD_MS);
        }
    }

    @Override
    public synchronized void close() {
        if (task != null) {
            task.cancel(false);
            task = null;
        }
    }
}
