package eu.toolchain.addressbook.messages;

import java.net.InetSocketAddress;

import lombok.Data;
import eu.toolchain.addressbook.Contact;

/**
 * Announces a contact which the recipient should add, and pass on, unless it already knows about it.
 */
@Data
public class AddContact implements Message {
    public static final String COMMAND = "add-contact";

    private final String id;
    private final InetSocketAddress address;

    public AddContact(String id, InetSocketAddress address) {
        this.id = id;
        this.address = InetSocketAddress.createUnresolved(address.getHostString(), address.getPort());
    }

    public static AddContact of(Contact contact) {
        return new AddContact(contact.getId(), contact.getAddress());
    }

    public Contact toContact() {
        return new Contact(id, address);
    }

    @Override
    public String getCommand() {
        return COMMAND;
    }
}
