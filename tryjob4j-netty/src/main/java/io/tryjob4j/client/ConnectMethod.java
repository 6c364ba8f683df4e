package io.tryjob4j.client;

/**
 * How a try client hands its job to the master.
 */
public enum ConnectMethod {
    /**
     * Authenticated network connection to a userpass scheduler. Supports waiting for results.
     */
    PB("pb"),
    /**
     * File dropped into a jobdir scheduler's mailbox. No return channel.
     */
    SSH("ssh");

    private final String label;

    ConnectMethod(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean supportsWaiting() {
        return this == PB;
    }

    public static ConnectMethod fromLabel(String label) {
        for (ConnectMethod m : values()) {
            if (m.label.equalsIgnoreCase(label)) {
                return m;
            }
        }
        throw new IllegalArgumentException("unknown connect method: " + label);
    }
}
