package io.taskvault.model;

public record ChecklistItem(String text, boolean done) {
    public static ChecklistItem open(String text) {
        return new ChecklistItem(text, false);
    }

    public ChecklistItem markDone() {
        return new ChecklistItem(text, true);
    }
}
