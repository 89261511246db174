package io.taskvault.approval;

import io.taskvault.model.PlanRecord;

public final class TemplateDraftComposer implements DraftComposer {
    private static final int EXCERPT_CHARS = 600;

    @Override
    public String compose(PlanRecord plan, String action) {
        String content = plan.originalContent() == null ? "" : plan.originalContent().strip();
        String excerpt = content.length() <= EXCERPT_CHARS ? content : content.substring(0, EXCERPT_CHARS) + "...";
        return "Proposed action: " + action + " (" + plan.domain().wireName() + ", " + plan.category() + ")\n\n"
                + "Original request:\n> " + excerpt.replace("\n", "\n> ");
    }
}
