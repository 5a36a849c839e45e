package eu.toolchain.addressbook.transport.tcp;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import eu.toolchain.addressbook.messages.Message;
import eu.toolchain.addressbook.serializers.MessageSerializer;
import eu.toolchain.addressbook.serializers.SerializerUtils;
import eu.toolchain.addressbook.transport.BindException;
import eu.toolchain.addressbook.transport.DeliveryException;
import eu.toolchain.addressbook.transport.Receiver;
import eu.toolchain.addressbook.transport.Transport;

/**
 * Sends every message over a connection of its own.
 *
 * A frame is the length of the encoded message followed by the message. The receiver answers with a single
 * {@link #ACK} byte once it has read the frame, and the message only counts as delivered when that byte arrives.
 *
 * Addresses received from other nodes are unresolved, their names are looked up when sending.
 */
@Slf4j
public class TcpTransport implements Transport {
    public static final long DEFAULT_CONNECT_TIMEOUT = 2000;
    public static final long DEFAULT_READ_TIMEOUT = 2000;

    static final int ACK = 0x01;

    @Getter
    private final int connectTimeout;
    @Getter
    private final int readTimeout;

    public TcpTransport() {
        this(DEFAULT_CONNECT_TIMEOUT, DEFAULT_READ_TIMEOUT);
    }

    public TcpTransport(final long connectTimeout, final long readTimeout) {
        if (connectTimeout <= 0 || readTimeout <= 0)
            throw new IllegalArgumentException("timeouts must be positive");

        this.connectTimeout = (int) Math.min(Integer.MAX_VALUE, connectTimeout);
        this.readTimeout = (int) Math.min(Integer.MAX_VALUE, readTimeout);
    }

    @Override
    public void send(final InetSocketAddress target, final Message message) throws DeliveryException {
        final byte[] frame;

        try {
            frame = SerializerUtils.toBytes(MessageSerializer.get(), message);
        } catch (final Exception e) {
            throw new IllegalArgumentException("failed to encode message: " + message, e);
        }

        final InetSocketAddress resolved = resolve(target);

        if (resolved.isUnresolved())
            throw new DeliveryException(target, "unresolved address");

        try (final Socket socket = new Socket()) {
            socket.connect(resolved, connectTimeout);
            socket.setSoTimeout(readTimeout);

            final DataOutputStream out = new DataOutputStream(socket.getOutputStream());
            out.writeInt(frame.length);
            out.write(frame);
            out.flush();

            final DataInputStream in = new DataInputStream(socket.getInputStream());

            if (in.read() != ACK)
                throw new DeliveryException(target, "message not acknowledged");
        } catch (final IOException e) {
            throw new DeliveryException(target, "failed to deliver message", e);
        }
    }

    private InetSocketAddress resolve(final InetSocketAddress target) {
        if (!target.isUnresolved())
            return target;

        return new InetSocketAddress(target.getHostString(), target.getPort());
    }

    @Override
    public Receiver listen(final InetSocketAddress address, final long notifyInterval) throws BindException {
        final TcpReceiver receiver = new TcpReceiver(address, notifyInterval, readTimeout);
        receiver.start();
        return receiver;
    }
}
