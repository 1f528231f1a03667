package com.nayem.tether.core;

/**
 * Thrown when a proxy is built with neither or both of a local actor and an actor id.
 */
public class ProxyConfigurationException extends RuntimeException {

    public ProxyConfigurationException(String message) {
        super(message);
    }
}
