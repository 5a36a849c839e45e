package eu.toolchain.addressbook.transport;

import java.net.InetSocketAddress;

/**
 * Inbound side of a transport, bound to a local address.
 */
public interface Receiver {
    InetSocketAddress getBindAddress();

    /**
     * Register the consumer of every message arriving at this receiver.
     *
     * @throws IllegalStateException if a consumer is already registered.
     */
    void register(final ReceiveMessage consumer);

    /**
     * Stop receiving. Messages arriving afterwards are not delivered.
     */
    void stop();
}
