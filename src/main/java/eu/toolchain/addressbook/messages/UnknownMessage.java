package eu.toolchain.addressbook.messages;

import lombok.Data;

/**
 * A message with a command this node does not understand.
 */
@Data
public class UnknownMessage implements Message {
    private final String command;
}
