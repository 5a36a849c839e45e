package eu.toolchain.addressbook.statistics;

import java.util.concurrent.atomic.AtomicLong;

import eu.toolchain.addressbook.Contact;
import eu.toolchain.addressbook.messages.AddContact;
import eu.toolchain.addressbook.messages.Ping;
import eu.toolchain.addressbook.messages.UnknownMessage;
import eu.toolchain.addressbook.transport.DeliveryException;

public class TallyReporter implements Reporter {
    private final AtomicLong sentAddContacts = new AtomicLong();
    private final AtomicLong sentPings = new AtomicLong();
    private final AtomicLong receivedPings = new AtomicLong();
    private final AtomicLong deliveryFailures = new AtomicLong();
    private final AtomicLong duplicateContacts = new AtomicLong();
    private final AtomicLong selfAnnouncements = new AtomicLong();
    private final AtomicLong unknownCommands = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public long getSentAddContacts() {
        return sentAddContacts.get();
    }

    public long getSentPings() {
        return sentPings.get();
    }

    public long getReceivedPings() {
        return receivedPings.get();
    }

    public long getDeliveryFailures() {
        return deliveryFailures.get();
    }

    public long getDuplicateContacts() {
        return duplicateContacts.get();
    }

    public long getSelfAnnouncements() {
        return selfAnnouncements.get();
    }

    public long getUnknownCommands() {
        return unknownCommands.get();
    }

    public long getEvictions() {
        return evictions.get();
    }

    @Override
    public void reportSentAddContact(Contact recipient, AddContact addContact) {
        sentAddContacts.incrementAndGet();
    }

    @Override
    public void reportSentPing(Contact recipient) {
        sentPings.incrementAndGet();
    }

    @Override
    public void reportReceivedPing(Ping ping) {
        receivedPings.incrementAndGet();
    }

    @Override
    public void reportDeliveryFailure(Contact recipient, DeliveryException e) {
        deliveryFailures.incrementAndGet();
    }

    @Override
    public void reportDuplicateContact(AddContact addContact) {
        duplicateContacts.incrementAndGet();
    }

    @Override
    public void reportSelfAnnouncement(AddContact addContact) {
        selfAnnouncements.incrementAndGet();
    }

    @Override
    public void reportUnknownCommand(UnknownMessage message) {
        unknownCommands.incrementAndGet();
    }

    @Override
    public void reportEviction(Contact contact) {
        evictions.incrementAndGet();
    }
}
