package com.handoff.backend.service.classifier;

import com.handoff.backend.model.Category;
import com.handoff.backend.model.EscalationReason;

import java.util.List;

import static com.handoff.backend.service.classifier.ClassificationRule.anyKeyword;

public final class DefaultRuleTables {

    public static final RuleTable<Category> CATEGORIES = new RuleTable<>(List.of(
            anyKeyword(Category.Outage, "outage", "service down", "no service", "no internet", "total loss",
                    "complete outage"),
            anyKeyword(Category.WiFi, "wifi", "wi-fi", "wireless", "signal", "ssid", "5ghz", "2.4ghz"),
            anyKeyword(Category.CGNAT, "cgnat", "carrier-grade nat", "port forward", "port mapping", "public ip"),
            anyKeyword(Category.Wiring, "cable", "wiring", "wire", "physical", "ont", "fiber", "ethernet"),
            anyKeyword(Category.EquipmentReturn, "return", "replace", "swap", "defective", "broken",
                    "faulty equipment")
    ), Category.Unknown);

    public static final RuleTable<EscalationReason> REASONS = new RuleTable<>(List.of(
            anyKeyword(EscalationReason.CallerRequested, "agent", "speak to", "talk to", "human", "representative",
                    "customer requested"),
            anyKeyword(EscalationReason.SafetyRisk, "safety", "danger", "risk", "emergency", "urgent", "hazard"),
            anyKeyword(EscalationReason.BillingOrAccount, "billing", "payment", "account", "charge", "invoice",
                    "refund"),
            anyKeyword(EscalationReason.TwoStepsNoResolve, "not resolved", "still broken", "didn't work",
                    "tried twice", "multiple attempts"),
            anyKeyword(EscalationReason.OutOfScope, "complex", "advanced", "beyond", "outside scope", "specialized")
    ), EscalationReason.Other);

    private DefaultRuleTables() {
    }
}
