package eu.toolchain.addressbook.serializers;

import java.net.InetSocketAddress;
import java.nio.ByteBuffer;

import eu.toolchain.addressbook.messages.AddContact;

public final class AddContactSerializer implements Serializer<AddContact> {
    private AddContactSerializer() {
    }

    private static final Serializer<AddContact> instance = new AddContactSerializer();

    public static Serializer<AddContact> get() {
        return instance;
    }

    @Override
    public void serialize(ByteBuffer b, AddContact data) throws Exception {
        StringSerializer.get().serialize(b, data.getId());
        InetSocketAddressSerializer.get().serialize(b, data.getAddress());
    }

    @Override
    public AddContact deserialize(ByteBuffer b) throws Exception {
        final String id = StringSerializer.get().deserialize(b);
        final InetSocketAddress address = InetSocketAddressSerializer.get().deserialize(b);
        return new AddContact(id, address);
    }
}
