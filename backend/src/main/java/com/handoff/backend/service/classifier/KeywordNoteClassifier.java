package com.handoff.backend.service.classifier;

import com.handoff.backend.model.Category;
import com.handoff.backend.model.EscalationReason;

public class KeywordNoteClassifier implements NoteClassifier {

    private final RuleTable<Category> categoryRules;
    private final RuleTable<EscalationReason> reasonRules;

    public KeywordNoteClassifier() {
        this(DefaultRuleTables.CATEGORIES, DefaultRuleTables.REASONS);
    }

    public KeywordNoteClassifier(RuleTable<Category> categoryRules, RuleTable<EscalationReason> reasonRules) {
        this.categoryRules = categoryRules;
        this.reasonRules = reasonRules;
    }

    @Override
    public Category inferCategory(String text) {
        return RuleTable.classify(text, categoryRules);
    }

    @Override
    public EscalationReason inferReason(String text) {
        return RuleTable.classify(text, reasonRules);
    }
}
