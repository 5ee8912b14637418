package plantcare.core.clock;

import java.util.concurrent.atomic.AtomicLong;

public final class ManualClock implements Clock {
    private final AtomicLong now;

    public ManualClock(long startMillis) {
        this.now = new AtomicLong(startMillis);
    }

    public static ManualClock ofSeconds(long startSeconds) {
        return new ManualClock(startSeconds * 1000L);
    }

    @Override
    public long nowMillis() {
        return now.get();
    }

    public void advanceMillis(long delta) {
        if (delta < 0) throw new IllegalArgumentException("delta < 0");
        now.addAndGet(delta);
    }

    public void advanceSeconds(long delta) {
        advanceMillis(delta * 1000L);
    }
}
