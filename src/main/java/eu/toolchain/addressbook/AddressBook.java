package eu.toolchain.addressbook;

import static eu.toolchain.addressbook.ContactFilters.and;
import static eu.toolchain.addressbook.ContactFilters.id;
import static eu.toolchain.addressbook.ContactFilters.inactive;
import static eu.toolchain.addressbook.ContactFilters.not;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import eu.toolchain.addressbook.messages.AddContact;
import eu.toolchain.addressbook.messages.Message;
import eu.toolchain.addressbook.messages.Ping;
import eu.toolchain.addressbook.messages.UnknownMessage;
import eu.toolchain.addressbook.statistics.NoopReporter;
import eu.toolchain.addressbook.statistics.Reporter;
import eu.toolchain.addressbook.transport.BindException;
import eu.toolchain.addressbook.transport.DeliveryException;
import eu.toolchain.addressbook.transport.ReceiveMessage;
import eu.toolchain.addressbook.transport.Receiver;
import eu.toolchain.addressbook.transport.Transport;

/**
 * The local view of a node, shares newly discovered contacts and evicts the ones which stay unreachable.
 *
 * New contacts spread by gossip. A node which learns about a contact it did not know of passes it on to every other
 * contact it knows, and ignores it if already known. Liveness is inferred from deliveries: a failed delivery marks
 * the recipient as inactive, a successful one as active. A background task pings inactive contacts and evicts those
 * which have been inactive for longer than the restore timeout.
 *
 * All access to the contacts goes through {@link #lock}, messages are sent outside of it.
 */
@Slf4j
public class AddressBook implements AutoCloseable {
    private static final long CLOSE_TIMEOUT = 10000;

    @Getter
    private final Contact self;
    private final Transport transport;
    @Getter
    private final AddressBookConfig config;
    private final Clock clock;
    private final Reporter reporter;
    private final ChangeListener listener;

    private final Object lock = new Object();

    /* contacts by id, in the order they were learned */
    private final Map<String, Contact> contacts = new LinkedHashMap<>();

    private Receiver receiver;
    private ScheduledExecutorService prober;
    private boolean closed = false;

    private AddressBook(Contact self, Collection<Contact> initial, Transport transport, AddressBookConfig config,
            Clock clock, Reporter reporter, ChangeListener listener) {
        this.self = self;
        this.transport = transport;
        this.config = config;
        this.clock = clock;
        this.reporter = reporter;
        this.listener = listener;

        for (final Contact contact : initial) {
            if (contact.getId().equals(self.getId()))
                continue;

            if (!contacts.containsKey(contact.getId()))
                contacts.put(contact.getId(), contact);
        }
    }

    private void start() throws BindException {
        receiver = transport.listen(self.getAddress(), config.getNotifyInterval());

        receiver.register(new ReceiveMessage() {
            @Override
            public void message(final Message message) throws Exception {
                handle(message);
            }
        });

        prober = Executors.newSingleThreadScheduledExecutor(new ThreadFactory() {
            @Override
            public Thread newThread(final Runnable r) {
                final Thread t = new Thread(r, "address-book-prober-" + self.getId());
                t.setDaemon(true);
                return t;
            }
        });

        final long interval = config.getProbeInterval();

        prober.scheduleWithFixedDelay(new Runnable() {
            @Override
            public void run() {
                try {
                    probeInactiveContacts();
                } catch (Exception e) {
                    log.error("{}: failed to probe inactive contacts", self.getId(), e);
                }
            }
        }, interval, interval, TimeUnit.MILLISECONDS);

        log.info("{}: listening on {} with {} contact(s)", self.getId(), receiver.getBindAddress(), size());
    }

    /**
     * Snapshot of the known contacts, in the order they were learned.
     */
    public List<Contact> getContacts() {
        synchronized (lock) {
            return Collections.unmodifiableList(new ArrayList<>(contacts.values()));
        }
    }

    public Contact getContact(String id) {
        synchronized (lock) {
            return contacts.get(id);
        }
    }

    public boolean contains(String id) {
        synchronized (lock) {
            return contacts.containsKey(id);
        }
    }

    public int size() {
        synchronized (lock) {
            return contacts.size();
        }
    }

    /**
     * Handle a message received from the network.
     *
     * Commands this node does not know about are ignored.
     */
    public void handle(final Message message) {
        if (isClosed())
            return;

        if (message instanceof AddContact) {
            handleAddContact((AddContact) message);
        } else if (message instanceof Ping) {
            reporter.reportReceivedPing((Ping) message);
        } else if (message instanceof UnknownMessage) {
            log.debug("{}: ignoring unknown command: {}", self.getId(), message.getCommand());
            reporter.reportUnknownCommand((UnknownMessage) message);
        } else {
            log.debug("{}: ignoring message: {}", self.getId(), message);
        }
    }

    /**
     * Add a contact discovered by this node, and tell every other contact about it.
     *
     * The contact replaces any known contact with the same id. When this method returns, the new contact has been sent
     * to every other contact, successfully or not.
     *
     * @throws IllegalArgumentException if the contact is this node.
     * @throws IllegalStateException if the address book is closed.
     */
    public void createNewDistributedContact(final Contact contact) {
        if (contact.getId().equals(self.getId()))
            throw new IllegalArgumentException("a node can not add itself: " + contact);

        final List<Contact> targets;

        synchronized (lock) {
            if (closed)
                throw new IllegalStateException("address book is closed");

            contacts.put(contact.getId(), contact);
            targets = forwardTargets(contact);
        }

        added(contact);
        forward(contact, targets);
    }

    /**
     * Send a message to a contact, and mark the link to it as up or down depending on the outcome.
     *
     * Only a known contact with the same id as the recipient changes state.
     *
     * @return {@code true} if the message was delivered.
     */
    public boolean sendMessageToContact(final Contact recipient, final Message message) {
        if (recipient.getId().equals(self.getId()))
            throw new IllegalArgumentException("a node never messages itself");

        try {
            transport.send(recipient.getAddress(), message);
        } catch (final DeliveryException e) {
            log.debug("{}: failed to deliver {} to {}: {}", self.getId(), message.getCommand(), recipient.getId(),
                    e.getMessage());
            reporter.reportDeliveryFailure(recipient, e);
            setLinkState(false, recipient);
            return false;
        }

        setLinkState(true, recipient);
        return true;
    }

    /**
     * Ping every inactive contact once, and evict the ones which are still unreachable after the restore timeout.
     *
     * Runs periodically in the background, active contacts are never pinged.
     */
    public void probeInactiveContacts() {
        final List<Contact> inactive;

        synchronized (lock) {
            inactive = contacts(inactive());
        }

        if (inactive.isEmpty())
            return;

        final Ping ping = new Ping();

        for (final Contact contact : inactive) {
            if (isClosed())
                return;

            try {
                probe(contact, ping);
            } catch (final RuntimeException e) {
                log.error("{}: failed to probe {}", self.getId(), contact, e);
            }
        }
    }

    /**
     * Stop receiving messages and stop the background prober.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (closed)
                return;

            closed = true;
        }

        receiver.stop();
        prober.shutdownNow();

        try {
            if (!prober.awaitTermination(CLOSE_TIMEOUT, TimeUnit.MILLISECONDS))
                log.warn("{}: prober did not stop within {} ms", self.getId(), CLOSE_TIMEOUT);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        log.info("{}: closed", self.getId());
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    private void handleAddContact(final AddContact addContact) {
        // a node must never add itself.
        if (addContact.getId().equals(self.getId())) {
            reporter.reportSelfAnnouncement(addContact);
            return;
        }

        final Contact contact = addContact.toContact();
        final List<Contact> targets;

        synchronized (lock) {
            if (contacts.containsKey(contact.getId()))
                targets = null;
            else {
                contacts.put(contact.getId(), contact);
                targets = forwardTargets(contact);
            }
        }

        if (targets == null) {
            log.debug("{}: already knows {}", self.getId(), contact.getId());
            reporter.reportDuplicateContact(addContact);
            return;
        }

        added(contact);
        forward(contact, targets);
    }

    private void probe(final Contact contact, final Ping ping) {
        reporter.reportSentPing(contact);

        if (sendMessageToContact(contact, ping)) {
            log.info("{}: {} is reachable again", self.getId(), contact.getId());
            return;
        }

        final long now = clock.now();
        final Contact evicted;
        final long unreachable;

        synchronized (lock) {
            final Contact known = contacts.get(contact.getId());

            // removed or replaced since the snapshot was taken.
            if (known == null || !known.isExpired(now, config.getRestoreTimeout()))
                return;

            unreachable = now - known.getFirstFailure();
            contacts.remove(known.getId());
            evicted = known;
        }

        log.info("{}: evicted {}, unreachable for {} second(s)", self.getId(), evicted.getId(),
                TimeUnit.SECONDS.convert(unreachable, TimeUnit.MILLISECONDS));

        reporter.reportEviction(evicted);
        listener.contactEvicted(this, evicted);
    }

    /**
     * Every known contact except the one being announced, which already knows itself, and this node.
     */
    private List<Contact> forwardTargets(final Contact announced) {
        return contacts(and(not(id(announced.getId())), not(id(self.getId()))));
    }

    private void forward(final Contact announced, final List<Contact> targets) {
        final AddContact message = AddContact.of(announced);

        for (final Contact target : targets) {
            reporter.reportSentAddContact(target, message);
            sendMessageToContact(target, message);
        }
    }

    private void added(final Contact contact) {
        log.info("{}: added {}", self.getId(), contact.getId());
        listener.contactAdded(this, contact);
    }

    private void setLinkState(final boolean up, final Contact recipient) {
        final long now = clock.now();

        synchronized (lock) {
            final Contact known = contacts.get(recipient.getId());

            if (known == null)
                return;

            if (up)
                known.linkUp();
            else
                known.linkDown(now);
        }
    }

    /* must be called while holding the lock */
    private List<Contact> contacts(final ContactFilter filter) {
        final List<Contact> result = new ArrayList<>();

        for (final Contact c : contacts.values()) {
            if (filter.matches(c))
                result.add(c);
        }

        return result;
    }

    @Override
    public String toString() {
        return "AddressBook(" + self.getId() + ")";
    }

    public static class Builder {
        private static final Reporter NOOP_REPORTER = new NoopReporter();

        private static final ChangeListener NOOP_LISTENER = new ChangeListener() {
            @Override
            public void contactAdded(AddressBook book, Contact contact) {
            }

            @Override
            public void contactEvicted(AddressBook book, Contact contact) {
            }
        };

        private Contact self;
        private final List<Contact> contacts = new ArrayList<>();
        private Transport transport;
        private AddressBookConfig config;
        private Clock clock;
        private Reporter reporter;
        private ChangeListener listener;

        public Builder self(Contact self) {
            if (self == null)
                throw new IllegalArgumentException("self must be specified");

            this.self = self;
            return this;
        }

        /**
         * Contacts known from the start, copied when called.
         */
        public Builder contacts(Collection<Contact> contacts) {
            if (contacts == null)
                throw new IllegalArgumentException("contacts must not be null");

            this.contacts.addAll(contacts);
            return this;
        }

        public Builder transport(Transport transport) {
            if (transport == null)
                throw new IllegalArgumentException("transport must be specified");

            this.transport = transport;
            return this;
        }

        public Builder config(AddressBookConfig config) {
            this.config = config;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder reporter(Reporter reporter) {
            this.reporter = reporter;
            return this;
        }

        public Builder listener(ChangeListener listener) {
            this.listener = listener;
            return this;
        }

        /**
         * Build the address book, and start receiving messages and probing inactive contacts.
         *
         * @throws BindException if the receiver could not be bound to the address of self.
         */
        public AddressBook build() throws BindException {
            if (self == null)
                throw new IllegalStateException("self is required");

            if (transport == null)
                throw new IllegalStateException("transport is required");

            AddressBookConfig config = this.config;

            if (config == null)
                config = AddressBookConfig.defaults();

            Clock clock = this.clock;

            if (clock == null)
                clock = Clocks.system();

            Reporter reporter = this.reporter;

            if (reporter == null)
                reporter = NOOP_REPORTER;

            ChangeListener listener = this.listener;

            if (listener == null)
                listener = NOOP_LISTENER;

            final AddressBook book = new AddressBook(self, contacts, transport, config, clock, reporter, listener);
            book.start();
            return book;
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
