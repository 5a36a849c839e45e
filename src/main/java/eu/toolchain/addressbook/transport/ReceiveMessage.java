package eu.toolchain.addressbook.transport;

import eu.toolchain.addressbook.messages.Message;

public interface ReceiveMessage {
    /**
     * Fires when receiving a message.
     */
    void message(Message message) throws Exception;
}
