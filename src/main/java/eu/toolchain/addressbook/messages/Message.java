package eu.toolchain.addressbook.messages;

/**
 * An envelope exchanged between address books.
 *
 * Known commands have their own type, anything else is decoded into an {@link UnknownMessage}.
 */
public interface Message {
    public String getCommand();
}
