package eu.toolchain.addressbook.serializers;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

public final class StringSerializer implements Serializer<String> {
    private StringSerializer() {
    }

    private static final Serializer<String> instance = new StringSerializer();

    public static Serializer<String> get() {
        return instance;
    }

    @Override
    public void serialize(ByteBuffer b, String data) {
        final byte[] bytes = data.getBytes(StandardCharsets.UTF_8);
        b.putInt(bytes.length);
        b.put(bytes);
    }

    @Override
    public String deserialize(ByteBuffer b) {
        final ByteBuffer region = SerializerUtils.readRegion(b);
        final byte[] bytes = new byte[region.remaining()];
        region.get(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
