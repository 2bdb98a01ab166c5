package cz.cas.jhinst.qsource3.protocol.mqtt.internal.publish;

import cz.cas.jhinst.qsource3.api.RequestResult;

/**
 * One outbound call, reduced to its outcome so that guards can wrap it.
 */
@FunctionalInterface
public interface OutboundOperation
{
    RequestResult run();
}
