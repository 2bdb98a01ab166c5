package cz.cas.jhinst.qsource3.api;

/**
 * Last status the device announced about itself.
 * <p>
 * This is independent of {@link ConnectionState}: the broker session may be
 * up while the device behind it is absent or failing.
 */
public enum DeviceStatus
{
    /** Nothing heard from the device since the broker session came up. */
    UNKNOWN,

    /** The device announced itself on its connected topic. */
    CONNECTED,

    /** The device reported an I/O error. */
    IO_ERROR
}
