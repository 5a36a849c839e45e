package eu.toolchain.addressbook.messages;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Liveness probe, carries no data.
 */
@ToString
@EqualsAndHashCode
public class Ping implements Message {
    public static final String COMMAND = "ping";

    @Override
    public String getCommand() {
        return COMMAND;
    }
}
