package org.dbos.dgraph.utilities;

public class DgraphConfig {
    public static final int defaultPort = 9080;
    public static final String defaultHost = "localhost";

    // ZeroMQ transport.
    public static int ioThreads = 1;
    public static int pollIntervalMs = 1;
    public static int lingerMs = 0;
    public static int highWaterMark = 0;  // Zero means unbounded.

    // Number of threads completing call futures, so user continuations never run on the I/O thread.
    public static int callbackThreads = 2;

    // Connection-level deadline applied when a call carries none. Zero or negative means no deadline.
    public static long defaultDeadlineMs = 0L;

    // Upper bound on how long close() waits for the I/O thread to exit.
    public static final long shutdownTimeoutMs = 10_000L;

    /**
     * Turn a <code>host</code>, <code>host:port</code>, <code>[v6]</code> or <code>[v6]:port</code> address into a
     * ZeroMQ TCP endpoint. A bare IPv6 literal such as <code>::1</code> is bracketed and given the default port.
     * @param address   the address.
     * @return          the <code>tcp://</code> endpoint.
     */
    public static String formatAddress(String address) {
        if (address.startsWith("tcp://")) {
            return address;
        }
        if (address.startsWith("[")) {
            int close = address.indexOf(']');
            if (close < 0) {
                throw new IllegalArgumentException("Unterminated IPv6 address: " + address);
            }
            return close == address.length() - 1 ? "tcp://" + address + ":" + defaultPort : "tcp://" + address;
        }
        int colon = address.indexOf(':');
        if (colon < 0) {
            return "tcp://" + address + ":" + defaultPort;
        }
        if (address.indexOf(':', colon + 1) >= 0) {
            return "tcp://[" + address + "]:" + defaultPort;
        }
        return "tcp://" + address;
    }
}
