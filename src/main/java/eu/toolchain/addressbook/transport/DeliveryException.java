package eu.toolchain.addressbook.transport;

import java.net.InetSocketAddress;

import lombok.Getter;

/**
 * Thrown when a message could not be delivered to its recipient.
 */
public class DeliveryException extends Exception {
    @Getter
    private final InetSocketAddress target;

    public DeliveryException(final InetSocketAddress target, final String message, final Throwable cause) {
        super(message + ": " + target, cause);
        this.target = target;
    }

    public DeliveryException(final InetSocketAddress target, final String message) {
        super(message + ": " + target);
        this.target = target;
    }
}
