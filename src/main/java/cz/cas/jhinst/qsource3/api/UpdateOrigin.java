package cz.cas.jhinst.qsource3.api;

/**
 * UpdateOrigin
 * -----------------------------------------------------------------------------
 * Tells a listener <em>why</em> a setting changed.
 *
 * <h2>Feedback-loop avoidance</h2>
 * An interactive surface that forwards its own edits to the engine also
 * displays every change the engine reports. If it re-published every reported
 * value, a device echo would bounce back to the device indefinitely.
 * <p>
 * The rule for front-ends is therefore:
 * <ul>
 *   <li>{@link #OPERATOR} changes were requested through the engine and have
 *       already been published; re-displaying them is optional</li>
 *   <li>{@link #DEVICE} and {@link #SNAPSHOT} changes must be applied to the
 *       display <b>without</b> issuing a new request</li>
 * </ul>
 *
 * The engine itself never suppresses notifications: a device report carrying
 * the value already held by the mirror is still delivered.
 */
public enum UpdateOrigin
{
    /** Change requested interactively and published to the device. */
    OPERATOR,

    /** Change reported by the device (state report or field echo). */
    DEVICE,

    /** Change caused by loading a persisted settings file. */
    SNAPSHOT
}
