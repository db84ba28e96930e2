package com.handoff.backend.service.classifier;

import com.handoff.backend.model.Category;
import com.handoff.backend.model.EscalationReason;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RuleTableTest {

    private final KeywordNoteClassifier classifier = new KeywordNoteClassifier();

    @Test
    void firstMatchingRuleWins() {
        RuleTable<String> table = new RuleTable<>(List.of(
                ClassificationRule.anyKeyword("first", "router"),
                ClassificationRule.anyKeyword("second", "router", "modem")
        ), "none");

        assertThat(RuleTable.classify("Router and modem down", table)).isEqualTo("first");
        assertThat(RuleTable.classify("modem only", table)).isEqualTo("second");
        assertThat(RuleTable.classify("nothing relevant", table)).isEqualTo("none");
        assertThat(RuleTable.classify(null, table)).isEqualTo("none");
    }

    @Test
    void outageOutranksOtherCategories() {
        assertThat(classifier.inferCategory("Complete outage, wifi lights off")).isEqualTo(Category.Outage);
        assertThat(classifier.inferCategory("Weak wireless signal upstairs")).isEqualTo(Category.WiFi);
        assertThat(classifier.inferCategory("Needs port forwarding for a camera")).isEqualTo(Category.CGNAT);
        assertThat(classifier.inferCategory("Fiber cable cut in the yard")).isEqualTo(Category.Wiring);
        assertThat(classifier.inferCategory("Router is defective, wants a swap")).isEqualTo(Category.EquipmentReturn);
        assertThat(classifier.inferCategory("General question")).isEqualTo(Category.Unknown);
    }

    @Test
    void reasonsFollowTablePriority() {
        assertThat(classifier.inferReason("Wants to speak to a human about a refund"))
                .isEqualTo(EscalationReason.CallerRequested);
        assertThat(classifier.inferReason("Sparking outlet, safety hazard")).isEqualTo(EscalationReason.SafetyRisk);
        assertThat(classifier.inferReason("Disputed invoice")).isEqualTo(EscalationReason.BillingOrAccount);
        assertThat(classifier.inferReason("Reboot didn't work")).isEqualTo(EscalationReason.TwoStepsNoResolve);
        assertThat(classifier.inferReason("Needs specialized routing setup")).isEqualTo(EscalationReason.OutOfScope);
        assertThat(classifier.inferReason("Just checking in")).isEqualTo(EscalationReason.Other);
    }

    @Test
    void classificationIsCaseInsensitive() {
        assertThat(classifier.inferCategory("WIFI DROPS")).isEqualTo(classifier.inferCategory("wifi drops"));
    }

    @Test
    void customTableCanReplaceDefaults() {
        KeywordNoteClassifier custom = new KeywordNoteClassifier(
                new RuleTable<>(List.of(ClassificationRule.anyKeyword(Category.Wiring, "jack")), Category.Unknown),
                DefaultRuleTables.REASONS);

        assertThat(custom.inferCategory("Broken phone jack")).isEqualTo(Category.Wiring);
        assertThat(custom.inferCategory("wifi")).isEqualTo(Category.Unknown);
    }
}
