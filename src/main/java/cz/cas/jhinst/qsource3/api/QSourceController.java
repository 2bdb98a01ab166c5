package cz.cas.jhinst.qsource3.api;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * QSourceController
 * -----------------------------------------------------------------------------
 * {@code QSourceController} is the semantic façade an operator-facing surface
 * uses to drive a remote QSource3 device.
 *
 * <h2>Core Responsibilities</h2>
 * <ul>
 *   <li>Accepting change requests for individual settings (INTENT)</li>
 *   <li>Exposing the local mirror of device settings (OBSERVATION)</li>
 *   <li>Forwarding telemetry and status to listeners</li>
 *   <li>Loading and saving settings files</li>
 * </ul>
 *
 * It is explicitly <b>not</b> responsible for:
 * <ul>
 *   <li>Rendering values or capturing user input</li>
 *   <li>Transport reliability (retries, backoff, QoS)</li>
 *   <li>Waiting for device confirmation of a request</li>
 * </ul>
 *
 * <h2>Optimistic updates</h2>
 * An accepted {@link #request(SettingField, Object)} updates the local mirror
 * immediately. If the device later reports a different value, that report wins
 * and listeners are notified with {@link UpdateOrigin#DEVICE}.
 *
 * <h2>Errors</h2>
 * Outbound problems are returned synchronously as {@link RequestResult.Rejected}
 * so an interactive surface can flag the offending input. Inbound problems
 * (malformed payloads, invalid reported values) are logged and dropped; there
 * is no caller to report them to.
 *
 * <h2>Threading and Concurrency</h2>
 * All methods are safe to call from any thread. Listener callbacks may run on
 * the transport thread; listeners must not block.
 */
public interface QSourceController
{
    /**
     * Validates {@code value}, applies it to the mirror and publishes it.
     *
     * @param field the setting to change
     * @param value candidate value; numbers, booleans, lists of
     *              {@link CalibrationPoint} or lists of two-element number lists
     *              are accepted according to the field
     */
    RequestResult request(SettingField field, Object value);

    /**
     * Asks the device to report its current value of {@code field}.
     * The mirror is not touched.
     */
    RequestResult requestCurrentValue(SettingField field);

    /**
     * Asks the device for its bulk state report.
     */
    RequestResult requestDeviceState();

    /**
     * @return a consistent copy of all settings as currently mirrored
     */
    SettingsSnapshot getSettings();

    ConnectionState getConnectionState();

    DeviceStatus getDeviceStatus();

    /**
     * Operator-facing labels for the mass range values 0, 1 and 2.
     */
    List<String> massRangeLabels();

    /**
     * Replaces all seven settings from a settings file, all or nothing.
     *
     * @throws SnapshotLoadException if the file cannot be read or any field is
     *                               missing or invalid; the mirror is unchanged
     */
    void loadSettings(Path file) throws SnapshotLoadException;

    /**
     * Writes the currently mirrored settings to a settings file.
     */
    void saveSettings(Path file) throws IOException;

    void addListener(EngineListener listener);

    void removeListener(EngineListener listener);
}
