package eu.toolchain.addressbook.transport.simulator;

import java.net.InetSocketAddress;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.Map;
import java.util.Set;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import eu.toolchain.addressbook.Clock;
import eu.toolchain.addressbook.messages.Message;
import eu.toolchain.addressbook.serializers.MessageSerializer;
import eu.toolchain.addressbook.serializers.SerializerUtils;
import eu.toolchain.addressbook.transport.BindException;
import eu.toolchain.addressbook.transport.DeliveryException;
import eu.toolchain.addressbook.transport.ReceiveMessage;
import eu.toolchain.addressbook.transport.Receiver;
import eu.toolchain.addressbook.transport.Transport;

/**
 * An in-memory network with a manual clock.
 *
 * Sending only queues a message, {@link #run()} delivers queued messages until the network is quiet. Sending to an
 * address which nobody listens on, or which is blocked, fails immediately. Time only moves through
 * {@link #advance(long)}.
 *
 * Nodes are told apart by host string and port, whether or not an address has been resolved.
 */
@Slf4j
public class SimulatorNetwork implements Transport, Clock {
    private final Map<String, SimulatorReceiver> receivers = new HashMap<>();
    private final Set<String> blocked = new HashSet<>();
    private final LinkedList<PendingMessage> pending = new LinkedList<>();

    private long tick = 0;

    public SimulatorNetwork() {
    }

    public SimulatorNetwork(long start) {
        this.tick = start;
    }

    @Override
    public void send(final InetSocketAddress target, final Message message) throws DeliveryException {
        final byte[] packet;

        try {
            packet = SerializerUtils.toBytes(MessageSerializer.get(), message);
        } catch (final Exception e) {
            throw new IllegalArgumentException("failed to encode message: " + message, e);
        }

        synchronized (this) {
            if (blocked.contains(key(target)))
                throw new DeliveryException(target, "blocked");

            final SimulatorReceiver receiver = receivers.get(key(target));

            if (receiver == null)
                throw new DeliveryException(target, "connection refused");

            pending.add(new PendingMessage(tick, target, packet));
        }
    }

    @Override
    public synchronized Receiver listen(final InetSocketAddress address, final long notifyInterval)
            throws BindException {
        if (receivers.containsKey(key(address)))
            throw new BindException("address already in use: " + address);

        final SimulatorReceiver receiver = new SimulatorReceiver(address);
        receivers.put(key(address), receiver);
        return receiver;
    }

    /**
     * Deliver queued messages, including the ones sent while delivering, until there are none left.
     *
     * @return The number of delivered messages.
     */
    public int run() {
        int delivered = 0;

        while (true) {
            final PendingMessage p;
            final SimulatorReceiver receiver;

            synchronized (this) {
                p = pending.poll();

                if (p == null)
                    return delivered;

                receiver = receivers.get(key(p.getDestination()));
            }

            // stopped after the message was sent.
            if (receiver == null)
                continue;

            receiver.deliver(p);
            delivered++;
        }
    }

    public synchronized int pendingMessages() {
        return pending.size();
    }

    public synchronized void block(final InetSocketAddress address) {
        blocked.add(key(address));
    }

    public synchronized void unblock(final InetSocketAddress address) {
        blocked.remove(key(address));
    }

    public synchronized void advance(final long ticks) {
        if (ticks < 0)
            throw new IllegalArgumentException("time can not go backwards");

        tick += ticks;
    }

    @Override
    public synchronized long now() {
        return tick;
    }

    private static String key(final InetSocketAddress address) {
        return address.getHostString() + ":" + address.getPort();
    }

    @RequiredArgsConstructor
    private class SimulatorReceiver implements Receiver {
        private final InetSocketAddress address;

        private ReceiveMessage consumer;

        @Override
        public InetSocketAddress getBindAddress() {
            return address;
        }

        @Override
        public void register(final ReceiveMessage consumer) {
            synchronized (SimulatorNetwork.this) {
                if (this.consumer != null)
                    throw new IllegalStateException("a consumer is already registered on " + address);

                this.consumer = consumer;
            }
        }

        @Override
        public void stop() {
            synchronized (SimulatorNetwork.this) {
                receivers.remove(key(address));
            }
        }

        private void deliver(final PendingMessage p) {
            final ReceiveMessage consumer;

            synchronized (SimulatorNetwork.this) {
                consumer = this.consumer;
            }

            if (consumer == null)
                return;

            try {
                consumer.message(SerializerUtils.fromBytes(MessageSerializer.get(), p.getPacket()));
            } catch (final Exception e) {
                log.error("consumer on {} threw exception", address, e);
            }
        }
    }
}
