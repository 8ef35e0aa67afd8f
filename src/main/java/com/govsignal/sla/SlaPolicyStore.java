package com.govsignal.sla;

import java.util.List;

public interface SlaPolicyStore {

    /** Active policies in stable storage order (ties in specificity resolve by this order). */
    List<SlaPolicy> findActive();

    void save(SlaPolicy policy);
}
