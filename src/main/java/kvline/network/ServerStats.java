package kvline.network;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

public class ServerStats {
    private final AtomicLong totalCommands = new AtomicLong(0);
    private final AtomicInteger activeConnections = new AtomicInteger(0);

    public void commandProcessed() {
        totalCommands.incrementAndGet();
    }

    public void connectionOpened() {
        activeConnections.incrementAndGet();
    }

    public void connectionClosed() {
        activeConnections.decrementAndGet();
    }

    public long getTotalCommands() {
        return totalCommands.get();
    }

    public int getActiveConnections() {
        return activeConnections.get();
    }
}
