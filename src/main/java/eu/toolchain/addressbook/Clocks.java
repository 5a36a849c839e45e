package eu.toolchain.addressbook;

public final class Clocks {
    private Clocks() {
    }

    private static final Clock system = new Clock() {
        @Override
        public long now() {
            return System.currentTimeMillis();
        }

        @Override
        public String toString() {
            return "SystemClock";
        }
    };

    /**
     * The wall clock, as reported by {@link System#currentTimeMillis()}.
     */
    public static Clock system() {
        return system;
    }
}
