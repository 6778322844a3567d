package com.qubi.controlhub.core.spi;

import java.util.Set;

/**
 * Convierte los candidatos propuestos para un statement en los nombres bajo los que se archiva.
 */
@FunctionalInterface
public interface ComponentFilter {
    Set<String> filter(Set<String> candidates);
}
