package com.example.waterrights.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * A code that is printed either alone or together with its name, e.g. map excerpts and catchment codes.
 */
public sealed interface SingleOrPair permits SingleOrPair.Single, SingleOrPair.Pair {

    record Single(long code) implements SingleOrPair {
        @JsonValue
        public List<Object> json() {
            return List.of(code);
        }
    }

    record Pair(long code, String name) implements SingleOrPair {
        @JsonValue
        public List<Object> json() {
            return List.of(code, name);
        }
    }

    long code();
}
