package com.nayem.tether.core;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * The answer to one {@link RequestEnvelope}, published on the sender's reply channel.
 *
 * @param replySlotId Correlation token copied from the request
 * @param result      The method's return value
 * @param error       Failure message when the method threw; null on success
 */
public record ResponseEnvelope(String replySlotId, Object result, String error) {

    public static ResponseEnvelope success(String replySlotId, Object result) {
        return new ResponseEnvelope(replySlotId, result, null);
    }

    public static ResponseEnvelope failure(String replySlotId, String error) {
        return new ResponseEnvelope(replySlotId, null, error);
    }

    @JsonIgnore
    public boolean isFailure() {
        return error != null;
    }
}
