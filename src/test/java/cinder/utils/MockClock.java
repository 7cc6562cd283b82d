package cinder.utils;

import java.util.concurrent.atomic.AtomicLong;

public class MockClock implements Time.Clock {
    private final AtomicLong currentTime;

    public MockClock() {
        this(System.currentTimeMillis());
    }

    public MockClock(long start) {
        this.currentTime = new AtomicLong(start);
    }

    @Override
    public long currentTimeMillis() {
        return currentTime.get();
    }

    public void advance(long millis) {
        currentTime.addAndGet(millis);
    }
}
