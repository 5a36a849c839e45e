package eu.toolchain.addressbook;

/**
 * Source of the current time, in milliseconds.
 *
 * @see Clocks
 */
public interface Clock {
    long now();
}
