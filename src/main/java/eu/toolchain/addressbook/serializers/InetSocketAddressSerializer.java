package eu.toolchain.addressbook.serializers;

import java.net.InetSocketAddress;
import java.nio.ByteBuffer;

/**
 * Addresses travel as host string and port. Decoding never resolves the host, that is left to whoever connects to it.
 */
public final class InetSocketAddressSerializer implements Serializer<InetSocketAddress> {
    private InetSocketAddressSerializer() {
    }

    private static final Serializer<InetSocketAddress> instance = new InetSocketAddressSerializer();

    public static Serializer<InetSocketAddress> get() {
        return instance;
    }

    @Override
    public void serialize(ByteBuffer b, InetSocketAddress a) throws Exception {
        StringSerializer.get().serialize(b, a.getHostString());
        b.putInt(a.getPort());
    }

    @Override
    public InetSocketAddress deserialize(ByteBuffer b) throws Exception {
        final String host = StringSerializer.get().deserialize(b);
        final int port = b.getInt();

        if (port < 0 || port > 0xFFFF)
            throw new IllegalArgumentException("Invalid port: " + port);

        return InetSocketAddress.createUnresolved(host, port);
    }
}
