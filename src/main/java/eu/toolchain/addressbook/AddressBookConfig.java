package eu.toolchain.addressbook;

import java.util.concurrent.TimeUnit;

import lombok.AccessLevel;
import lombok.Data;
import lombok.RequiredArgsConstructor;

/**
 * Tunables of an {@link AddressBook}, all durations in milliseconds.
 */
@Data
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class AddressBookConfig {
    public static final long DEFAULT_RESTORE_TIMEOUT = TimeUnit.MILLISECONDS.convert(3600, TimeUnit.SECONDS);
    public static final long DEFAULT_PROBE_INTERVAL = TimeUnit.MILLISECONDS.convert(1799, TimeUnit.SECONDS);
    public static final long DEFAULT_NOTIFY_INTERVAL = TimeUnit.MILLISECONDS.convert(1, TimeUnit.SECONDS);

    /**
     * How long a contact may stay inactive before it is evicted.
     */
    private final long restoreTimeout;

    /**
     * How often inactive contacts are probed.
     */
    private final long probeInterval;

    /**
     * How often the receiver hands queued messages over to the address book.
     */
    private final long notifyInterval;

    public static AddressBookConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private long restoreTimeout = DEFAULT_RESTORE_TIMEOUT;
        private long probeInterval = DEFAULT_PROBE_INTERVAL;
        private long notifyInterval = DEFAULT_NOTIFY_INTERVAL;

        public Builder restoreTimeout(long duration, TimeUnit unit) {
            if (duration < 0)
                throw new IllegalArgumentException("restore timeout must not be negative");

            this.restoreTimeout = TimeUnit.MILLISECONDS.convert(duration, unit);
            return this;
        }

        public Builder probeInterval(long duration, TimeUnit unit) {
            if (duration <= 0)
                throw new IllegalArgumentException("probe interval must be positive");

            this.probeInterval = TimeUnit.MILLISECONDS.convert(duration, unit);
            return this;
        }

        public Builder notifyInterval(long duration, TimeUnit unit) {
            if (duration <= 0)
                throw new IllegalArgumentException("notify interval must be positive");

            this.notifyInterval = TimeUnit.MILLISECONDS.convert(duration, unit);
            return this;
        }

        public AddressBookConfig build() {
            if (probeInterval <= 0)
                throw new IllegalStateException("probe interval must be at least one millisecond");

            if (notifyInterval <= 0)
                throw new IllegalStateException("notify interval must be at least one millisecond");

            return new AddressBookConfig(restoreTimeout, probeInterval, notifyInterval);
        }
    }
}
