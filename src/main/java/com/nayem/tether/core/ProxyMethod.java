package com.nayem.tether.core;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Local stand-in for one remote actor method.
 */
@FunctionalInterface
public interface ProxyMethod {

    CompletableFuture<Object> call(List<Object> args, Map<String, Object> kwargs);

    default CompletableFuture<Object> invoke(Object... args) {
        return call(Arrays.asList(args), Map.of());
    }
}
