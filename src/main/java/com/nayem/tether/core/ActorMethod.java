package com.nayem.tether.core;

/**
 * A method body in an actor's dispatch table.
 */
@FunctionalInterface
public interface ActorMethod {

    Object invoke(Invocation invocation) throws Exception;
}
