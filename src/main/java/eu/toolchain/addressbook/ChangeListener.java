package eu.toolchain.addressbook;

public interface ChangeListener {
    public void contactAdded(AddressBook book, Contact contact);

    public void contactEvicted(AddressBook book, Contact contact);
}
