package eu.toolchain.addressbook;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

import lombok.extern.slf4j.Slf4j;
import eu.toolchain.addressbook.statistics.TallyReporter;
import eu.toolchain.addressbook.transport.tcp.TcpTransport;

/**
 * Grows a small network on loopback, one node at a time, then kills a node and waits for the others to evict it.
 */
@Slf4j
public class App {
    private static final String HOST = "127.0.0.1";

    public static void main(final String[] args) throws Exception {
        final int nodes = args.length > 0 ? Integer.parseInt(args[0]) : 5;
        final int base = args.length > 1 ? Integer.parseInt(args[1]) : 8001;

        final Random random = new Random(0);
        final TcpTransport transport = new TcpTransport(500, 500);
        final TallyReporter reporter = new TallyReporter();

        final AddressBookConfig config = AddressBookConfig.builder().restoreTimeout(0, TimeUnit.SECONDS)
                .probeInterval(1, TimeUnit.SECONDS).notifyInterval(10, TimeUnit.MILLISECONDS).build();

        final ChangeListener listener = new ChangeListener() {
            @Override
            public void contactAdded(AddressBook book, Contact contact) {
                log.info("{}: found {}", book.getSelf().getId(), contact.getId());
            }

            @Override
            public void contactEvicted(AddressBook book, Contact contact) {
                log.info("{}: lost {}", book.getSelf().getId(), contact.getId());
            }
        };

        final List<AddressBook> books = new ArrayList<>();

        try {
            final Contact root = new Contact(ContactIds.generate(), HOST, base);
            books.add(AddressBook.builder().self(root).transport(transport).config(config).reporter(reporter)
                    .listener(listener).build());

            for (int i = 1; i < nodes; i++) {
                final AddressBook parent = books.get(random.nextInt(books.size()));

                // the new node starts out knowing everything its parent knows, and the parent.
                final List<Contact> known = copyOf(parent.getContacts());
                known.add(new Contact(parent.getSelf().getId(), parent.getSelf().getAddress()));

                final Contact child = new Contact(ContactIds.generate(parent.getSelf().getId()), HOST, base + i);

                books.add(AddressBook.builder().self(child).contacts(known).transport(transport).config(config)
                        .reporter(reporter).listener(listener).build());

                log.info("{} replicates into {}", parent.getSelf().getId(), child.getId());
                parent.createNewDistributedContact(new Contact(child.getId(), child.getAddress()));

                Thread.sleep(500);
            }

            printViews(books);

            final AddressBook killed = books.remove(random.nextInt(books.size()));
            log.info("killing {}", killed.getSelf().getId());
            killed.close();

            // nobody sends to the killed node on its own, announce one more node to trigger the failure.
            final AddressBook announcer = books.get(0);
            final Contact late = new Contact(ContactIds.generate(announcer.getSelf().getId()), HOST, base + nodes);
            books.add(AddressBook.builder().self(late).contacts(copyOf(announcer.getContacts())).transport(transport)
                    .config(config).reporter(reporter).listener(listener).build());
            announcer.createNewDistributedContact(new Contact(late.getId(), late.getAddress()));

            Thread.sleep(3000);

            printViews(books);

            log.info("sent add-contacts: {}, sent pings: {}, delivery failures: {}, evictions: {}",
                    reporter.getSentAddContacts(), reporter.getSentPings(), reporter.getDeliveryFailures(),
                    reporter.getEvictions());
        } finally {
            for (final AddressBook book : books)
                book.close();
        }

        System.exit(0);
    }

    private static List<Contact> copyOf(final List<Contact> contacts) {
        final List<Contact> copy = new ArrayList<>();

        for (final Contact c : contacts)
            copy.add(new Contact(c.getId(), c.getAddress()));

        return copy;
    }

    private static void printViews(final List<AddressBook> books) {
        for (final AddressBook book : books) {
            final StringBuilder ids = new StringBuilder();

            for (final Contact c : book.getContacts()) {
                if (ids.length() > 0)
                    ids.append(", ");

                ids.append(c.getId(), 0, 8);
            }

            log.info("{} has {} contact(s): {}", book.getSelf().getId().substring(0, 8), book.size(), ids);
        }
    }
}
