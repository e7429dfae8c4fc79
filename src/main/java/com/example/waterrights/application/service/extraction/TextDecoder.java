package com.example.waterrights.application.service.extraction;

/**
 * Turns the raw operand bytes of a text show instruction into text.
 */
@FunctionalInterface
public interface TextDecoder {

    String decode(byte[] bytes);
}
