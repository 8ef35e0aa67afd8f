package com.govsignal.decision;

import com.govsignal.decision.DecisionIntelligence.Priority;
import com.govsignal.decision.DecisionIntelligence.Rag;
import com.govsignal.decision.DecisionIntelligence.Urgency;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class DecisionIntelligenceTest {

    private Locale previous;

    @BeforeEach
    void useTurkishLocale() {
        previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
    }

    @AfterEach
    void restoreLocale() {
        Locale.setDefault(previous);
    }

    @Test
    @DisplayName("Wire values do not depend on the default locale")
    void wireValues_areLocaleIndependent() {
        assertEquals("immediate", Urgency.IMMEDIATE.getValue());
        assertEquals("this_sprint", Urgency.THIS_SPRINT.getValue());
        assertEquals("high", Priority.HIGH.getValue());
        assertEquals("amber", Rag.AMBER.getValue());
    }

    @Test
    void parsing_isLocaleIndependent() {
        assertEquals(Priority.HIGH, Priority.fromValue("high"));
        assertEquals(Urgency.IMMEDIATE, Urgency.fromValue("Immediate"));
        assertEquals(Rag.GREEN, Rag.fromValue(" green "));
    }
}
