package eu.toolchain.addressbook.serializers;

import java.nio.ByteBuffer;

public final class SerializerUtils {
    /**
     * Largest encoded message, same as the largest datagram.
     */
    public static final int MAX_SIZE = 0xFFFF;

    private SerializerUtils() {
    }

    public static <T> byte[] toBytes(Serializer<T> serializer, T value) throws Exception {
        final ByteBuffer b = ByteBuffer.allocate(MAX_SIZE);
        serializer.serialize(b, value);
        b.flip();

        final byte[] bytes = new byte[b.remaining()];
        b.get(bytes);
        return bytes;
    }

    public static <T> T fromBytes(Serializer<T> serializer, byte[] bytes) throws Exception {
        return serializer.deserialize(ByteBuffer.wrap(bytes));
    }

    /**
     * Read a length prefixed region of the buffer, and advance past it.
     */
    public static ByteBuffer readRegion(ByteBuffer b) {
        final int length = b.getInt();

        if (length < 0 || length > b.remaining())
            throw new IllegalArgumentException("Invalid length " + length + ", only " + b.remaining()
                    + " byte(s) remaining");

        final ByteBuffer region = b.slice();
        region.limit(length);
        b.position(b.position() + length);
        return region;
    }
}
