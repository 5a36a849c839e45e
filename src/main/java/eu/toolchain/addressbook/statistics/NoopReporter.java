package eu.toolchain.addressbook.statistics;

import eu.toolchain.addressbook.Contact;
import eu.toolchain.addressbook.messages.AddContact;
import eu.toolchain.addressbook.messages.Ping;
import eu.toolchain.addressbook.messages.UnknownMessage;
import eu.toolchain.addressbook.transport.DeliveryException;

public class NoopReporter implements Reporter {
    @Override
    public void reportSentAddContact(Contact recipient, AddContact addContact) {
    }

    @Override
    public void reportSentPing(Contact recipient) {
    }

    @Override
    public void reportReceivedPing(Ping ping) {
    }

    @Override
    public void reportDeliveryFailure(Contact recipient, DeliveryException e) {
    }

    @Override
    public void reportDuplicateContact(AddContact addContact) {
    }

    @Override
    public void reportSelfAnnouncement(AddContact addContact) {
    }

    @Override
    public void reportUnknownCommand(UnknownMessage message) {
    }

    @Override
    public void reportEviction(Contact contact) {
    }
}
