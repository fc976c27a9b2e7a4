package com.repolens.core.cache;

import com.repolens.core.model.ContextBundle;

@FunctionalInterface
public interface BundleComputation<E extends Exception> {

    ContextBundle compute() throws E;
}
