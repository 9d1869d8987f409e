package com.simfolio.backend.model;

public enum ConcentrationRiskLevel {
    LOW,
    MEDIUM,
    HIGH
}
