package com.govsignal.routing;

import com.govsignal.contract.ArtifactEvent;
import com.govsignal.contract.InvalidEventException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Rule Router: deterministic dispatch from an artifact event to suggestion drafts.
 *
 * The dispatch is a closed match over {@link EventKind}; a new rule means a new
 * kind and a new arm, never a change to how dispatch works. Unknown
 * (artifact_type, action) pairs are not an error and route to nothing.
 */
public class RuleRouter {

    private static final Logger log = LoggerFactory.getLogger(RuleRouter.class);

    private final SuggestionRule charterRule;
    private final SuggestionRule stakeholderRule;

    public RuleRouter(SuggestionRule charterRule, SuggestionRule stakeholderRule) {
        this.charterRule = charterRule;
        this.stakeholderRule = stakeholderRule;
    }

    public List<SuggestionDraft> route(ArtifactEvent event) {
        if (event == null || event.getId() == null || event.getProjectId() == null) {
            throw new InvalidEventException("event must carry id and project_id to be routed");
        }

        EventKind kind = EventKind.classify(event.getArtifactType(), event.getAction());
        List<SuggestionDraft> drafts = switch (kind) {
            case PROJECT_CHARTER_CHANGED -> apply(charterRule, event);
            case STAKEHOLDER_REGISTER_CHANGED -> apply(stakeholderRule, event);
            case UNRECOGNIZED -> List.of();
        };

        if (kind == EventKind.UNRECOGNIZED) {
            log.debug("No rule for artifact_type={} action={} event_id={}",
                event.getArtifactType(), event.getAction(), event.getId());
        }
        return drafts;
    }

    private List<SuggestionDraft> apply(SuggestionRule rule, ArtifactEvent event) {
        List<SuggestionDraft> drafts = List.copyOf(rule.draft(event));
        log.info("Rule {}/{} drafted {} suggestion(s) for event_id={}",
            rule.ruleId(), rule.ruleVersion(), drafts.size(), event.getId());
        return drafts;
    }
}
