package eu.toolchain.addressbook;

import java.util.List;

import lombok.Data;

public interface ContactFilter {
    public boolean matches(Contact contact);

    @Data
    public static class Not implements ContactFilter {
        private final ContactFilter delegate;

        @Override
        public boolean matches(Contact contact) {
            return !delegate.matches(contact);
        }
    }

    @Data
    public static class Id implements ContactFilter {
        private final String id;

        @Override
        public boolean matches(Contact contact) {
            return id.equals(contact.getId());
        }
    }

    @Data
    public static class Active implements ContactFilter {
        @Override
        public boolean matches(Contact contact) {
            return contact.isActive();
        }
    }

    @Data
    public static class And implements ContactFilter {
        private final List<ContactFilter> delegates;

        @Override
        public boolean matches(Contact contact) {
            for (final ContactFilter f : delegates) {
                if (!f.matches(contact))
                    return false;
            }

            return true;
        }
    }
}
