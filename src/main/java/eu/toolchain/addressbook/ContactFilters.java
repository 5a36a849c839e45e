package eu.toolchain.addressbook;

import java.util.Arrays;

public final class ContactFilters {
    private ContactFilters() {
    }

    public static ContactFilter id(String id) {
        return new ContactFilter.Id(id);
    }

    public static ContactFilter active() {
        return new ContactFilter.Active();
    }

    public static ContactFilter inactive() {
        return not(active());
    }

    public static ContactFilter not(ContactFilter delegate) {
        return new ContactFilter.Not(delegate);
    }

    public static ContactFilter and(ContactFilter... delegates) {
        return new ContactFilter.And(Arrays.asList(delegates));
    }
}
