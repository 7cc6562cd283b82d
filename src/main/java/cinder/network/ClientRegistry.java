package cinder.network;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts open connections against the configured client limit and hands out connection ids.
 */
public class ClientRegistry {
    private final int maxClients;
    private final AtomicInteger connected = new AtomicInteger();
    private final AtomicLong nextId = new AtomicLong(1);

    public ClientRegistry(int maxClients) {
        this.maxClients = maxClients;
    }

    /**
     * Claims a slot. Returns false, without claiming anything, when the limit is reached.
     */
    public boolean tryRegister() {
        while (true) {
            int current = connected.get();
            if (current >= maxClients) return false;
            if (connected.compareAndSet(current, current + 1)) return true;
        }
    }

    public void unregister() {
        connected.decrementAndGet();
    }

    public long nextId() {
        return nextId.getAndIncrement();
    }

    public int connectedClients() {
        return connected.get();
    }

    public int getMaxClients() {
        return maxClients;
    }
}
