package cz.cas.jhinst.qsource3.api;

/**
 * Receives one notification per successful settings mutation.
 * <p>
 * Notifications for the same field are delivered in the order the mutations
 * were applied. They may arrive on the transport thread.
 */
@FunctionalInterface
public interface SettingsListener
{
    void onSettingChanged(SettingChange change);
}
