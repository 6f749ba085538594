package com.marketpush.dispatch;

import com.marketpush.config.PushProperties;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Process-wide pacing for gateway sends.
 *
 * <p>Every caller reserves the next free slot under a short lock and then sleeps
 * outside it until the slot arrives, so consecutive sends are at least
 * {@code push.dispatch.pacing} apart no matter how many workers are sending.
 */
@Component
public class SendRateGate {

    private static final Logger log = LoggerFactory.getLogger(SendRateGate.class);

    private final long intervalNanos;
    private long nextSlotNanos = Long.MIN_VALUE;

    public SendRateGate(PushProperties pushProperties) {
        Duration pacing = pushProperties.getDispatch().getPacing();
        this.intervalNanos = pacing != null ? Math.max(0, pacing.toNanos()) : 0;
    }

    /** Blocks until the caller may send. */
    public void acquire() throws InterruptedException {
        long waitNanos = reserve(System.nanoTime());
        if (waitNanos > 0) {
            log.trace("Pacing send, waiting {} ms", waitNanos / 1_000_000);
            Thread.sleep(waitNanos / 1_000_000, (int) (waitNanos % 1_000_000));
        }
    }

    /**
     * Testable version: reserves a slot relative to the given clock reading.
     *
     * @return nanos the caller must wait before its slot
     */
    public synchronized long reserve(long nowNanos) {
        long slot = nextSlotNanos == Long.MIN_VALUE || nowNanos - nextSlotNanos > 0 ? nowNanos : nextSlotNanos;
        nextSlotNanos = slot + intervalNanos;
        return slot - nowNanos;
    }

    public Duration getInterval() {
        return Duration.ofNanos(intervalNanos);
    }
}
