package eu.toolchain.addressbook;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import eu.toolchain.addressbook.messages.AddContact;
import eu.toolchain.addressbook.messages.Ping;
import eu.toolchain.addressbook.messages.UnknownMessage;
import eu.toolchain.addressbook.statistics.TallyReporter;
import eu.toolchain.addressbook.transport.BindException;
import eu.toolchain.addressbook.transport.DeliveryException;
import eu.toolchain.addressbook.transport.simulator.SimulatorNetwork;

public class TestAddressBook {
    private static final long RESTORE_TIMEOUT = 10000;

    private final List<AddressBook> books = new ArrayList<>();

    private SimulatorNetwork network;
    private TallyReporter reporter;
    private List<Contact> evicted;
    private List<Contact> added;

    private final Contact self = contact("1", 8001);

    @Before
    public void setup() {
        network = new SimulatorNetwork();
        reporter = new TallyReporter();
        evicted = Collections.synchronizedList(new ArrayList<Contact>());
        added = Collections.synchronizedList(new ArrayList<Contact>());
    }

    @After
    public void teardown() {
        for (final AddressBook book : books)
            book.close();
    }

    private static Contact contact(String id, int port) {
        return new Contact(id, "127.0.0.1", port);
    }

    /* a remote node which only records what it receives */
    private MessageRecorder listen(Contact contact) throws BindException {
        final MessageRecorder recorder = new MessageRecorder();
        network.listen(contact.getAddress(), 1).register(recorder);
        return recorder;
    }

    private AddressBook book(Contact self, Contact... contacts) throws BindException {
        // the background prober never fires during a test, cycles are run by hand.
        final AddressBookConfig config = AddressBookConfig.builder()
                .restoreTimeout(RESTORE_TIMEOUT, TimeUnit.MILLISECONDS).probeInterval(1, TimeUnit.DAYS).build();

        final AddressBook book = AddressBook.builder().self(self).contacts(Arrays.asList(contacts))
                .transport(network).clock(network).config(config).reporter(reporter).listener(new ChangeListener() {
                    @Override
                    public void contactAdded(AddressBook book, Contact contact) {
                        added.add(contact);
                    }

                    @Override
                    public void contactEvicted(AddressBook book, Contact contact) {
                        evicted.add(contact);
                    }
                }).build();

        books.add(book);
        return book;
    }

    @Test
    public void testInitialContactsAreCopied() throws Exception {
        final List<Contact> initial = new ArrayList<>();
        initial.add(contact("a", 8002));

        final AddressBook book = AddressBook.builder().self(self).contacts(initial).transport(network).build();
        books.add(book);

        initial.add(contact("b", 8003));

        assertEquals(1, book.size());
        assertFalse(book.contains("b"));
    }

    @Test
    public void testSelfIsNeverAnInitialContact() throws Exception {
        final AddressBook book = book(self, contact("1", 8001), contact("a", 8002), contact("a", 8003));

        assertEquals(1, book.size());
        assertFalse(book.contains("1"));
        assertEquals(8002, book.getContact("a").getAddress().getPort());
    }

    @Test
    public void testAddContactForwardsToOtherContacts() throws Exception {
        final Contact a = contact("a", 8002);
        final Contact b = contact("b", 8003);
        final Contact p = contact("p", 8004);

        final MessageRecorder recorderA = listen(a);
        final MessageRecorder recorderB = listen(b);
        final MessageRecorder recorderP = listen(p);

        final AddressBook book = book(self, a, b);

        book.handle(AddContact.of(p));
        network.run();

        assertEquals(3, book.size());
        assertTrue(book.contains("p"));
        assertEquals(Collections.singletonList(AddContact.of(p)), recorderA.getMessages());
        assertEquals(Collections.singletonList(AddContact.of(p)), recorderB.getMessages());
        assertTrue(recorderP.getMessages().isEmpty());

        // nothing came back to self.
        assertEquals(2, reporter.getSentAddContacts());
        assertEquals(0, reporter.getDuplicateContacts());
        assertEquals(Collections.singletonList(p), added);
    }

    @Test
    public void testDuplicateAddContactIsIgnored() throws Exception {
        final Contact a = contact("a", 8002);
        final Contact p = contact("p", 8004);
        final MessageRecorder recorderA = listen(a);

        final AddressBook book = book(self, a);

        book.handle(AddContact.of(p));
        book.handle(AddContact.of(p));
        book.handle(new AddContact("p", new InetSocketAddress("127.0.0.1", 9999)));
        network.run();

        assertEquals(2, book.size());
        assertEquals(8004, book.getContact("p").getAddress().getPort());
        assertEquals(1, recorderA.getMessages().size());
        assertEquals(1, reporter.getSentAddContacts());
        assertEquals(2, reporter.getDuplicateContacts());
    }

    @Test
    public void testAddContactAboutSelfIsIgnored() throws Exception {
        final Contact a = contact("a", 8002);
        final MessageRecorder recorderA = listen(a);

        final AddressBook book = book(self, a);

        book.handle(AddContact.of(self));
        network.run();

        assertFalse(book.contains(self.getId()));
        assertEquals(1, book.size());
        assertTrue(recorderA.getMessages().isEmpty());
        assertEquals(1, reporter.getSelfAnnouncements());
    }

    @Test
    public void testUnknownCommandIsIgnored() throws Exception {
        final Contact a = contact("a", 8002);
        final Contact b = contact("b", 8003);
        b.linkDown(0);

        final AddressBook book = book(self, a, b);

        network.send(self.getAddress(), new UnknownMessage("noop"));
        assertEquals(1, network.run());

        assertEquals(2, book.size());
        assertTrue(book.getContact("a").isActive());
        assertEquals(Long.valueOf(0), book.getContact("b").getFirstFailure());
        assertEquals(1, reporter.getUnknownCommands());
        assertEquals(0, reporter.getSentAddContacts());
    }

    @Test
    public void testPingHasNoEffect() throws Exception {
        final AddressBook book = book(self, contact("a", 8002));

        network.send(self.getAddress(), new Ping());
        network.run();

        assertEquals(1, book.size());
        assertEquals(1, reporter.getReceivedPings());
    }

    @Test
    public void testCreateNewDistributedContact() throws Exception {
        final Contact a = contact("a", 8002);
        final Contact p = contact("p", 8004);
        final MessageRecorder recorderA = listen(a);
        final MessageRecorder recorderP = listen(p);

        final AddressBook book = book(self, a);
        book.createNewDistributedContact(p);

        // every forward has been attempted when the call returns.
        assertEquals(1, network.pendingMessages());
        network.run();

        assertSame(p, book.getContact("p"));
        assertEquals(Collections.singletonList(AddContact.of(p)), recorderA.getMessages());
        assertTrue(recorderP.getMessages().isEmpty());
    }

    @Test
    public void testCreateNewDistributedContactReplacesKnownContact() throws Exception {
        final Contact stale = contact("p", 8004);
        stale.linkDown(0);

        final AddressBook book = book(self, stale);

        final Contact fresh = contact("p", 8005);
        book.createNewDistributedContact(fresh);

        assertEquals(1, book.size());
        assertSame(fresh, book.getContact("p"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCreateNewDistributedContactRejectsSelf() throws Exception {
        book(self).createNewDistributedContact(contact("1", 8001));
    }

    @Test
    public void testFailedForwardMarksContactInactive() throws Exception {
        final Contact a = contact("a", 8002);
        final AddressBook book = book(self, a);

        network.advance(500);
        book.createNewDistributedContact(contact("p", 8004));

        assertFalse(a.isActive());
        assertEquals(Long.valueOf(500), a.getFirstFailure());
        assertEquals(1, reporter.getDeliveryFailures());
    }

    @Test
    public void testSendMessageToContact() throws Exception {
        final Contact a = contact("a", 8002);
        final AddressBook book = book(self, a);

        network.advance(100);
        assertFalse(book.sendMessageToContact(a, new Ping()));
        assertEquals(Long.valueOf(100), a.getFirstFailure());

        network.advance(100);
        assertFalse(book.sendMessageToContact(a, new Ping()));
        assertEquals(Long.valueOf(100), a.getFirstFailure());

        listen(a);
        assertTrue(book.sendMessageToContact(a, new Ping()));
        assertTrue(a.isActive());
    }

    @Test
    public void testSendMessageResolvesRecipientById() throws Exception {
        final Contact a = contact("a", 8002);
        final AddressBook book = book(self, a);

        final Contact copy = contact("a", 8002);
        assertFalse(book.sendMessageToContact(copy, new Ping()));

        assertFalse(a.isActive());
        assertTrue(copy.isActive());
    }

    @Test
    public void testSendMessageToUnknownContact() throws Exception {
        final AddressBook book = book(self);
        final Contact stranger = contact("x", 8010);

        assertFalse(book.sendMessageToContact(stranger, new Ping()));

        assertTrue(stranger.isActive());
        assertEquals(0, book.size());
    }

    @Test
    public void testActiveContactsAreNotProbed() throws Exception {
        final AddressBook book = book(self, contact("a", 8002), contact("b", 8003));

        network.advance(RESTORE_TIMEOUT * 2);
        book.probeInactiveContacts();

        assertEquals(2, book.size());
        assertEquals(0, reporter.getSentPings());
    }

    @Test
    public void testEvictAfterRestoreTimeout() throws Exception {
        final Contact a = contact("a", 8002);
        final AddressBook book = book(self, a);

        assertFalse(book.sendMessageToContact(a, new Ping()));

        network.advance(RESTORE_TIMEOUT - 1);
        book.probeInactiveContacts();
        assertTrue(book.contains("a"));
        assertEquals(Long.valueOf(0), a.getFirstFailure());

        network.advance(1);
        book.probeInactiveContacts();
        assertFalse(book.contains("a"));

        assertEquals(2, reporter.getSentPings());
        assertEquals(1, reporter.getEvictions());
        assertEquals(Collections.singletonList(a), evicted);
    }

    @Test
    public void testRestoredContactIsNotEvicted() throws Exception {
        final Contact a = contact("a", 8002);
        final AddressBook book = book(self, a);

        assertFalse(book.sendMessageToContact(a, new Ping()));

        network.advance(RESTORE_TIMEOUT / 2);
        listen(a);
        book.probeInactiveContacts();
        assertTrue(a.isActive());

        network.advance(RESTORE_TIMEOUT * 2);
        book.probeInactiveContacts();

        assertTrue(book.contains("a"));
        assertEquals(1, reporter.getSentPings());
        assertTrue(evicted.isEmpty());
    }

    @Test
    public void testProbingContinuesPastUnreachableContacts() throws Exception {
        final Contact a = contact("a", 8002);
        final Contact b = contact("b", 8003);
        final Contact c = contact("c", 8004);

        final AddressBook book = book(self, a, b, c);

        book.sendMessageToContact(a, new Ping());
        book.sendMessageToContact(b, new Ping());
        book.sendMessageToContact(c, new Ping());

        listen(b);

        network.advance(RESTORE_TIMEOUT);
        book.probeInactiveContacts();

        assertFalse(book.contains("a"));
        assertTrue(book.contains("b"));
        assertFalse(book.contains("c"));
        assertEquals(3, reporter.getSentPings());
    }

    @Test
    public void testEvictedContactCanBeRediscovered() throws Exception {
        final Contact a = contact("a", 8002);
        final AddressBook book = book(self, a);

        book.sendMessageToContact(a, new Ping());
        network.advance(RESTORE_TIMEOUT);
        book.probeInactiveContacts();
        assertFalse(book.contains("a"));

        book.handle(AddContact.of(a));
        assertTrue(book.contains("a"));
        assertTrue(book.getContact("a").isActive());
    }

    @Test
    public void testBackgroundProberEvicts() throws Exception {
        final Contact a = contact("a", 8002);

        final AddressBookConfig config = AddressBookConfig.builder().restoreTimeout(0, TimeUnit.MILLISECONDS)
                .probeInterval(10, TimeUnit.MILLISECONDS).build();

        final AddressBook book = AddressBook.builder().self(self).contacts(Collections.singletonList(a))
                .transport(network).clock(network).config(config).reporter(reporter).build();
        books.add(book);

        book.sendMessageToContact(a, new Ping());

        final long deadline = System.currentTimeMillis() + 5000;

        while (book.contains("a")) {
            if (System.currentTimeMillis() > deadline)
                fail("contact was not evicted in time");

            Thread.sleep(10);
        }

        assertEquals(1, reporter.getEvictions());
    }

    @Test
    public void testClose() throws Exception {
        final AddressBook book = book(self, contact("a", 8002));

        book.close();
        book.close();

        assertTrue(book.isClosed());

        try {
            network.send(self.getAddress(), new Ping());
            fail("receiver should be stopped");
        } catch (final DeliveryException e) {
            assertEquals(self.getAddress(), e.getTarget());
        }

        book.handle(AddContact.of(contact("p", 8004)));
        assertFalse(book.contains("p"));

        try {
            book.createNewDistributedContact(contact("q", 8005));
            fail("closed address book accepted a contact");
        } catch (final IllegalStateException e) {
            assertNull(book.getContact("q"));
        }
    }

    @Test(expected = BindException.class)
    public void testAddressInUse() throws Exception {
        book(self);
        book(contact("2", 8001));
    }

    @Test(expected = IllegalStateException.class)
    public void testSelfRequired() throws Exception {
        AddressBook.builder().transport(network).build();
    }

    @Test
    public void testDefaults() throws Exception {
        final AddressBook book = AddressBook.builder().self(self).transport(network).build();
        books.add(book);

        assertNotNull(book.getConfig());
        assertEquals(AddressBookConfig.DEFAULT_RESTORE_TIMEOUT, book.getConfig().getRestoreTimeout());
        assertSame(self, book.getSelf());
    }

    /**
     * Inbound announcements, local creations, probe cycles and the passing of time all race on one book. None of them
     * may fail, and the view must stay free of duplicates and of self.
     */
    @Test
    public void testConcurrentUpdates() throws Exception {
        final int threads = 4;
        final int rounds = 500;
        final int pool = 8;

        final AddressBook book = book(self, contact("a", 8002));

        final ConcurrentLinkedQueue<Throwable> errors = new ConcurrentLinkedQueue<>();
        final CountDownLatch start = new CountDownLatch(1);
        final ExecutorService executor = Executors.newFixedThreadPool(threads);

        try {
            for (int t = 0; t < threads; t++) {
                final int offset = t;

                executor.execute(new Runnable() {
                    @Override
                    public void run() {
                        try {
                            start.await();

                            for (int i = 0; i < rounds; i++) {
                                final int n = (i + offset) % pool;
                                final Contact c = contact("c" + n, 9000 + n);

                                switch ((i + offset) % 5) {
                                case 0:
                                    book.handle(AddContact.of(c));
                                    break;
                                case 1:
                                    book.handle(AddContact.of(self));
                                    break;
                                case 2:
                                    book.createNewDistributedContact(c);
                                    break;
                                case 3:
                                    book.probeInactiveContacts();
                                    break;
                                default:
                                    network.advance(RESTORE_TIMEOUT / 4);
                                    break;
                                }
                            }
                        } catch (final Throwable e) {
                            errors.add(e);
                        }
                    }
                });
            }

            start.countDown();
            executor.shutdown();
            assertTrue("workers did not finish", executor.awaitTermination(30, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }

        assertTrue(errors.toString(), errors.isEmpty());

        final Set<String> ids = new HashSet<>();

        for (final Contact c : book.getContacts())
            assertTrue("duplicate " + c, ids.add(c.getId()));

        assertFalse(ids.contains(self.getId()));
        assertEquals(ids.size(), book.size());
        assertTrue(reporter.getSelfAnnouncements() > 0);
    }
}
