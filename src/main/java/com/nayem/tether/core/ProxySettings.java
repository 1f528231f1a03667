package com.nayem.tether.core;

import java.time.Duration;

/**
 * Reply listener and call timing for proxies.
 *
 * @param pollTimeout  How long one poll of the reply subscription blocks
 * @param pollInterval Fixed pause after every poll
 * @param callTimeout  Default per-call timeout; null waits forever
 */
public record ProxySettings(Duration pollTimeout, Duration pollInterval, Duration callTimeout) {

    public static ProxySettings defaults() {
        return new ProxySettings(Duration.ofMillis(100), Duration.ofMillis(10), null);
    }

    public ProxySettings withCallTimeout(Duration callTimeout) {
        return new ProxySettings(pollTimeout, pollInterval, callTimeout);
    }
}
