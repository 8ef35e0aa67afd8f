package com.govsignal.decision;

import java.util.List;

public interface DecisionStore {

    /** Decisions of one project in log order (date raised, then ref). */
    List<Decision> findByProject(String projectId);

    void save(String projectId, Decision decision);
}
