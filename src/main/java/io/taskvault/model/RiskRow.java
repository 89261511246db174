package io.taskvault.model;

public record RiskRow(String risk, String level, String notes) {
}
