package com.nayem.tether.lock;

/**
 * Proof of a successful acquisition.
 *
 * @param name   The lock key
 * @param expiry The expiry value this holder wrote, epoch seconds as a plain decimal
 */
public record LockHandle(String name, String expiry) {
}
