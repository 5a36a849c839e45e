package eu.toolchain.addressbook.serializers;

import java.nio.ByteBuffer;

import eu.toolchain.addressbook.messages.AddContact;
import eu.toolchain.addressbook.messages.Message;
import eu.toolchain.addressbook.messages.Ping;
import eu.toolchain.addressbook.messages.UnknownMessage;

/**
 * Envelope codec.
 *
 * An envelope is the command name followed by a length prefixed data region. An empty region means that the message
 * carries no data. The region of an unknown command is skipped, which lets older nodes ignore newer commands.
 * An {@link UnknownMessage} is encoded without data.
 */
public final class MessageSerializer implements Serializer<Message> {
    private MessageSerializer() {
    }

    private static final Serializer<Message> instance = new MessageSerializer();

    public static Serializer<Message> get() {
        return instance;
    }

    @Override
    public void serialize(ByteBuffer b, Message data) throws Exception {
        StringSerializer.get().serialize(b, data.getCommand());

        final int lengthPosition = b.position();
        b.putInt(0);

        if (data instanceof AddContact) {
            AddContactSerializer.get().serialize(b, (AddContact) data);
        } else if (!(data instanceof Ping) && !(data instanceof UnknownMessage)) {
            throw new IllegalArgumentException("Message can not be encoded: " + data);
        }

        b.putInt(lengthPosition, b.position() - lengthPosition - 4);
    }

    @Override
    public Message deserialize(ByteBuffer b) throws Exception {
        final String command = StringSerializer.get().deserialize(b);
        final ByteBuffer data = SerializerUtils.readRegion(b);

        switch (command) {
        case AddContact.COMMAND:
            return AddContactSerializer.get().deserialize(data);
        case Ping.COMMAND:
            return new Ping();
        default:
            return new UnknownMessage(command);
        }
    }
}
