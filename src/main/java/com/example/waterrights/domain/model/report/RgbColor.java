package com.example.waterrights.domain.model.report;

public record RgbColor(float r, float g, float b) {
}
