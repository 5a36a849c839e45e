package eu.toolchain.addressbook;

import java.net.InetSocketAddress;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A known peer.
 *
 * The identity (id and address) never changes, the liveness does. A contact is active until a delivery to it fails,
 * after which it stays inactive until a delivery succeeds again.
 */
@EqualsAndHashCode(of = { "id" })
public class Contact {
    @Getter
    private final String id;
    @Getter
    private final InetSocketAddress address;

    // when the current unreachable streak began, null while active.
    private Long firstFailure;

    public Contact(String id, InetSocketAddress address) {
        this(id, address, null);
    }

    public Contact(String id, InetSocketAddress address, Long firstFailure) {
        if (id == null)
            throw new IllegalArgumentException("id must be specified");

        if (address == null)
            throw new IllegalArgumentException("address must be specified");

        this.id = id;
        this.address = address;
        this.firstFailure = firstFailure;
    }

    public Contact(String id, String host, int port) {
        this(id, new InetSocketAddress(host, port));
    }

    public synchronized Long getFirstFailure() {
        return firstFailure;
    }

    /**
     * Mark the link as down, unless it already is.
     */
    public void linkDown() {
        linkDown(System.currentTimeMillis());
    }

    /**
     * Mark the link as down at the given time, unless it already is.
     *
     * @param now Current time in milliseconds since the epoch.
     */
    public synchronized void linkDown(long now) {
        if (firstFailure == null)
            firstFailure = now;
    }

    public synchronized void linkUp() {
        if (firstFailure != null)
            firstFailure = null;
    }

    public synchronized boolean isActive() {
        return firstFailure == null;
    }

    /**
     * Check if the current unreachable streak has lasted for at least the given timeout.
     *
     * @return {@code true} if the contact is inactive and has been for {@code timeout} milliseconds or more.
     */
    public synchronized boolean isExpired(long now, long timeout) {
        return firstFailure != null && now - firstFailure >= timeout;
    }

    @Override
    public synchronized String toString() {
        return "Contact(id=" + id + ", address=" + address + ", firstFailure=" + firstFailure + ")";
    }
}
