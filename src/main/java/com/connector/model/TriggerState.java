package com.connector.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Persisted progress of a polling trigger for one (scenario, module) pair.
 *
 * @param status        {@link TriggerStatus#UNINITIALIZED} until the epoch call has established a baseline.
 * @param lastId        Id of the last emitted (or baseline) item.
 * @param lastDate      Ordering value of the last emitted item; {@code null} when nothing was seen yet.
 * @param idsAtLastDate Every id already emitted at {@code lastDate}, used to tie-break equal dates.
 */
public record TriggerState(TriggerStatus status, String lastId, JsonNode lastDate, Set<String> idsAtLastDate) {

    public TriggerState {
        idsAtLastDate = idsAtLastDate == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(idsAtLastDate));
    }

    public static TriggerState uninitialized() {
        return new TriggerState(TriggerStatus.UNINITIALIZED, null, null, null);
    }

    @JsonIgnore
    public boolean isInitialized() {
        return status == TriggerStatus.POLLING;
    }
}
