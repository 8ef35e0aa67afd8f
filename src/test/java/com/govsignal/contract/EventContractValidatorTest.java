package com.govsignal.contract;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class EventContractValidatorTest {

    private EventContractValidator validator;

    @BeforeEach
    void setUp() {
        validator = new EventContractValidator();
    }

    @Nested
    @DisplayName("Required fields")
    class RequiredFields {

        @Test
        void validEvent_passes() {
            assertDoesNotThrow(() -> validator.validate(event()));
        }

        @Test
        void idMayBeOmitted() {
            ArtifactEvent e = event();
            e.setId(null);
            assertDoesNotThrow(() -> validator.validate(e));
        }

        @Test
        void nullEvent_rejected() {
            assertThrows(InvalidEventException.class, () -> validator.validate(null));
        }

        @Test
        void missingProjectId_rejected() {
            ArtifactEvent e = event();
            e.setProjectId(" ");
            InvalidEventException ex = assertThrows(InvalidEventException.class, () -> validator.validate(e));
            assertTrue(ex.getMessage().contains("project_id"));
        }

        @Test
        void missingArtifactId_rejected() {
            ArtifactEvent e = event();
            e.setArtifactId(null);
            InvalidEventException ex = assertThrows(InvalidEventException.class, () -> validator.validate(e));
            assertTrue(ex.getMessage().contains("artifact_id"));
        }

        @Test
        void missingArtifactType_rejected() {
            ArtifactEvent e = event();
            e.setArtifactType(null);
            InvalidEventException ex = assertThrows(InvalidEventException.class, () -> validator.validate(e));
            assertTrue(ex.getMessage().contains("artifact_type"));
        }

        @Test
        void missingAction_rejected() {
            ArtifactEvent e = event();
            e.setAction("");
            InvalidEventException ex = assertThrows(InvalidEventException.class, () -> validator.validate(e));
            assertTrue(ex.getMessage().contains("action"));
        }
    }

    @Nested
    @DisplayName("Field format")
    class FieldFormat {

        @Test
        void nonUuidId_rejected() {
            ArtifactEvent e = event();
            e.setId("evt-1");
            assertThrows(InvalidEventException.class, () -> validator.validate(e));
        }

        @Test
        void overlongArtifactType_rejected() {
            ArtifactEvent e = event();
            e.setArtifactType("x".repeat(65));
            assertThrows(InvalidEventException.class, () -> validator.validate(e));
        }

        @Test
        void processingColumns_cannotBeSetByProducer() {
            ArtifactEvent e = event();
            e.setProcessedAt(Instant.now());
            assertThrows(InvalidEventException.class, () -> validator.validate(e));

            ArtifactEvent withError = event();
            withError.setProcessError("boom");
            assertThrows(InvalidEventException.class, () -> validator.validate(withError));
        }
    }

    @Nested
    @DisplayName("Payload shape")
    class PayloadShape {

        @Test
        void stakeholdersAsList_passes() {
            ArtifactEvent e = event();
            e.setPayload(Map.of("stakeholders", List.of(Map.of("name", "Ann"))));
            assertDoesNotThrow(() -> validator.validate(e));
        }

        @Test
        void stakeholdersAsString_rejected() {
            ArtifactEvent e = event();
            e.setPayload(Map.of("stakeholders", "Ann, Bob"));
            InvalidEventException ex = assertThrows(InvalidEventException.class, () -> validator.validate(e));
            assertTrue(ex.getMessage().contains("stakeholders"));
        }

        @Test
        void missingPayload_passes() {
            ArtifactEvent e = event();
            e.setPayload(null);
            assertDoesNotThrow(() -> validator.validate(e));
        }
    }

    private ArtifactEvent event() {
        return new ArtifactEvent(UUID.randomUUID().toString(), "proj-1", "art-1",
            "project_charter", "created", Map.of(), Instant.parse("2026-03-01T10:00:00Z"));
    }
}
