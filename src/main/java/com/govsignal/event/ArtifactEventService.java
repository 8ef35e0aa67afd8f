package com.govsignal.event;

import com.govsignal.api.DuplicateEventException;
import com.govsignal.contract.ArtifactEvent;
import com.govsignal.contract.EventContractValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

@Service
public class ArtifactEventService {

    private static final Logger log = LoggerFactory.getLogger(ArtifactEventService.class);

    private final EventContractValidator validator;
    private final ArtifactEventStore eventStore;
    private final Clock clock;

    public ArtifactEventService(EventContractValidator validator,
                                ArtifactEventStore eventStore,
                                Clock clock) {
        this.validator = validator;
        this.eventStore = eventStore;
        this.clock = clock;
    }

    public ArtifactEvent append(ArtifactEvent event) {
        validator.validate(event);

        if (event.getId() == null) {
            event.setId(UUID.randomUUID().toString());
        } else if (eventStore.existsById(event.getId())) {
            throw new DuplicateEventException(event.getId());
        }
        if (event.getCreatedAt() == null) {
            event.setCreatedAt(clock.instant());
        }
        event.setArtifactType(event.getArtifactType().trim().toLowerCase(Locale.ROOT));
        event.setAction(event.getAction().trim().toLowerCase(Locale.ROOT));

        ArtifactEvent appended = eventStore.append(event);
        log.info("Appended artifact event id={} project={} type={} action={}",
            appended.getId(), appended.getProjectId(), appended.getArtifactType(), appended.getAction());
        return appended;
    }

    public Optional<ArtifactEvent> find(String eventId) {
        return eventStore.findById(eventId);
    }
}
