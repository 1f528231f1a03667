package com.nayem.tether.core;

public class EnvelopeCodecException extends RuntimeException {

    public EnvelopeCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
