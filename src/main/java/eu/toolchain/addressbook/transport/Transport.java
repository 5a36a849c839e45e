package eu.toolchain.addressbook.transport;

import java.net.InetSocketAddress;

import eu.toolchain.addressbook.messages.Message;

public interface Transport {
    /**
     * Deliver a message, failing instead of blocking indefinitely when the target does not respond.
     *
     * @throws DeliveryException if the target could not be reached.
     */
    void send(final InetSocketAddress target, final Message message) throws DeliveryException;

    /**
     * Start listening on the port of the given address.
     *
     * @param notifyInterval How often, in milliseconds, received messages are handed over to the consumer.
     */
    Receiver listen(final InetSocketAddress address, final long notifyInterval) throws BindException;
}
