package eu.toolchain.addressbook.transport.simulator;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import eu.toolchain.addressbook.messages.Message;
import eu.toolchain.addressbook.messages.Ping;
import eu.toolchain.addressbook.messages.UnknownMessage;
import eu.toolchain.addressbook.transport.BindException;
import eu.toolchain.addressbook.transport.DeliveryException;
import eu.toolchain.addressbook.transport.ReceiveMessage;

public class TestSimulatorNetwork {
    private final SimulatorNetwork network = new SimulatorNetwork();

    private final InetSocketAddress a = new InetSocketAddress("127.0.0.1", 5000);
    private final InetSocketAddress b = new InetSocketAddress("127.0.0.1", 5001);

    @Test
    public void testRunDeliversUntilQuiet() throws Exception {
        final List<Message> received = new ArrayList<>();

        // a relays everything to b.
        network.listen(a, 1).register(new ReceiveMessage() {
            @Override
            public void message(Message message) throws Exception {
                network.send(b, message);
            }
        });

        network.listen(b, 1).register(new ReceiveMessage() {
            @Override
            public void message(Message message) {
                received.add(message);
            }
        });

        network.send(a, new UnknownMessage("hello"));

        assertEquals(2, network.run());
        assertEquals(1, received.size());
        assertEquals(new UnknownMessage("hello"), received.get(0));
    }

    @Test
    public void testBlock() throws Exception {
        network.listen(a, 1);
        network.block(a);

        try {
            network.send(a, new Ping());
            fail("blocked address accepted a message");
        } catch (final DeliveryException e) {
            assertEquals(a, e.getTarget());
        }

        network.unblock(a);
        network.send(a, new Ping());
        assertEquals(1, network.pendingMessages());
    }

    @Test(expected = DeliveryException.class)
    public void testNobodyListening() throws Exception {
        network.send(b, new Ping());
    }

    @Test(expected = BindException.class)
    public void testAddressInUse() throws Exception {
        network.listen(a, 1);
        network.listen(a, 1);
    }

    @Test
    public void testUnresolvedAddressReachesSameNode() throws Exception {
        final InetSocketAddress unresolved = InetSocketAddress.createUnresolved("127.0.0.1", 5000);

        network.listen(a, 1);
        network.send(unresolved, new Ping());
        assertEquals(1, network.pendingMessages());

        network.block(unresolved);

        try {
            network.send(a, new Ping());
            fail("blocked address accepted a message");
        } catch (final DeliveryException e) {
            assertEquals(a, e.getTarget());
        }
    }

    @Test
    public void testClock() {
        network.advance(250);
        network.advance(250);
        assertEquals(500, network.now());
    }
}
