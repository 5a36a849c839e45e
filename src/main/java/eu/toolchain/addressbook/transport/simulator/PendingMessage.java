package eu.toolchain.addressbook.transport.simulator;

import java.net.InetSocketAddress;

import lombok.Data;

@Data
public class PendingMessage {
    private final long tick;
    private final InetSocketAddress destination;
    private final byte[] packet;
}
