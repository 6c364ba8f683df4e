package io.tryjob4j.internal.netty;

import java.net.InetSocketAddress;

/**
 * Where a running userpass scheduler accepts connections.
 */
public record SchedulerRegistration(String schedulerName, InetSocketAddress address) {

    /**
     * The bound port; the real one even when the scheduler was configured with port 0.
     */
    public int getPort() {
        return address.getPort();
    }
}
