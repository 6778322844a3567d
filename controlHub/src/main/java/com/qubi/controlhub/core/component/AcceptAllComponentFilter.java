package com.qubi.controlhub.core.component;

import com.qubi.controlhub.core.spi.ComponentFilter;

import java.util.Set;
import java.util.TreeSet;

/**
 * Para reconocedores que ya reportan nombres canónicos.
 */
public class AcceptAllComponentFilter implements ComponentFilter {
    @Override
    public Set<String> filter(Set<String> candidates) {
        return candidates == null ? new TreeSet<>() : new TreeSet<>(candidates);
    }
}
