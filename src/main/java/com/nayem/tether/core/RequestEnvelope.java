package com.nayem.tether.core;

import java.util.List;
import java.util.Map;

/**
 * A method call on its way from a proxy to an actor.
 *
 * @param senderProxyId Id of the proxy whose reply channel receives the response
 * @param replySlotId   Correlation token for the single pending call
 * @param methodName    The actor method to invoke
 * @param args          Positional arguments
 * @param kwargs        Keyword arguments
 */
public record RequestEnvelope(
        String senderProxyId,
        String replySlotId,
        String methodName,
        List<Object> args,
        Map<String, Object> kwargs) {

    public RequestEnvelope {
        args = args == null ? List.of() : args;
        kwargs = kwargs == null ? Map.of() : kwargs;
    }
}
