package com.scholary.inference.failover;

/** A call that can be directed at any model id of a family. */
@FunctionalInterface
public interface ModelCall<T> {

  T call(String modelId);
}
