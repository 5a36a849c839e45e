package eu.toolchain.addressbook;

import java.util.ArrayList;
import java.util.List;

import eu.toolchain.addressbook.messages.Message;
import eu.toolchain.addressbook.transport.ReceiveMessage;

/**
 * Stands in for a remote node, remembers everything it receives.
 */
public class MessageRecorder implements ReceiveMessage {
    private final List<Message> messages = new ArrayList<>();

    @Override
    public synchronized void message(Message message) {
        messages.add(message);
    }

    public synchronized List<Message> getMessages() {
        return new ArrayList<>(messages);
    }
}
