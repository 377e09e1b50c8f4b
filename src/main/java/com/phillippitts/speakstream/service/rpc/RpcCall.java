package com.phillippitts.speakstream.service.rpc;

/**
 * A remote operation that can be invoked more than once.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface RpcCall<T> {

    T execute();
}
