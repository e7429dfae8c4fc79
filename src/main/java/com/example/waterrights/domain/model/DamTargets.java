package com.example.waterrights.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Levels a dam should be kept at ("Stauziele").
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DamTargets {

    private Quantity defaultLevel;
    private Quantity steady;
    private Quantity max;

    public Quantity getDefaultLevel() {
        return defaultLevel;
    }

    public void setDefaultLevel(Quantity defaultLevel) {
        this.defaultLevel = defaultLevel;
    }

    /**
     * @return "Dauerstau"
     */
    public Quantity getSteady() {
        return steady;
    }

    public void setSteady(Quantity steady) {
        this.steady = steady;
    }

    /**
     * @return "Höchststau"
     */
    public Quantity getMax() {
        return max;
    }

    public void setMax(Quantity max) {
        this.max = max;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return defaultLevel == null && steady == null && max == null;
    }
}
