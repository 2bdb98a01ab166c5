package cz.cas.jhinst.qsource3.api;

import java.util.Objects;

/**
 * Notification that a single setting now holds {@code value}.
 *
 * @param field  the setting that changed
 * @param value  the new value, in the canonical form documented on
 *               {@link SettingsSnapshot}
 * @param origin who caused the change
 */
public record SettingChange(SettingField field, Object value, UpdateOrigin origin)
{
    public SettingChange {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(origin, "origin");
    }

    public boolean isFromDevice() {
        return origin == UpdateOrigin.DEVICE;
    }
}
