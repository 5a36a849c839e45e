package eu.toolchain.addressbook.statistics;

import eu.toolchain.addressbook.Contact;
import eu.toolchain.addressbook.messages.AddContact;
import eu.toolchain.addressbook.messages.Ping;
import eu.toolchain.addressbook.messages.UnknownMessage;
import eu.toolchain.addressbook.transport.DeliveryException;

public interface Reporter {
    void reportSentAddContact(Contact recipient, AddContact addContact);

    void reportSentPing(Contact recipient);

    void reportReceivedPing(Ping ping);

    void reportDeliveryFailure(Contact recipient, DeliveryException e);

    void reportDuplicateContact(AddContact addContact);

    void reportSelfAnnouncement(AddContact addContact);

    void reportUnknownCommand(UnknownMessage message);

    void reportEviction(Contact contact);
}
