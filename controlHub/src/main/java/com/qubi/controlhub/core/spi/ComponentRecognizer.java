package com.qubi.controlhub.core.spi;

import java.util.Set;

/**
 * Propone los componentes que menciona el texto de un statement. Puede ser un modelo entrenado
 * o un diccionario; quien llama sólo asume texto de entrada y nombres de salida.
 */
@FunctionalInterface
public interface ComponentRecognizer {
    Set<String> recognize(String text);
}
