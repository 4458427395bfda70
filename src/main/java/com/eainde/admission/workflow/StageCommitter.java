package com.eainde.admission.workflow;

import com.eainde.admission.model.AgentLogEntry;
import com.eainde.admission.model.ApplicationRecord;
import com.eainde.admission.model.ApplicationStage;
import com.eainde.admission.model.StageFailure;
import com.eainde.admission.repository.ApplicationRepository;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;

/**
 * Single write path for stage transitions. The new stage, its output and the matching
 * event are committed in one repository update, then listeners are notified.
 */
@Log4j2
@Component
public class StageCommitter {

    private final ApplicationRepository repository;
    private final List<StageTransitionListener> listeners;
    private final Clock clock;

    public StageCommitter(ApplicationRepository repository, List<StageTransitionListener> listeners, Clock clock) {
        this.repository = repository;
        this.listeners = List.copyOf(listeners);
        this.clock = clock;
    }

    /**
     * @param transition builds the next snapshot from the current one and the commit time
     */
    public ApplicationRecord commit(String applicationId,
                                    BiFunction<ApplicationRecord, Instant, ApplicationRecord> transition,
                                    String agent,
                                    String action,
                                    Map<String, Object> details) {
        AtomicReference<ApplicationStage> from = new AtomicReference<>();
        ApplicationRecord committed = repository.update(applicationId, current -> {
            from.set(current.currentStage());
            Instant now = clock.instant();
            return transition.apply(current, now).appendEvent(new AgentLogEntry(now, agent, action, details));
        });
        notifyListeners(from.get(), committed);
        return committed;
    }

    /**
     * Moves the application to ERROR unless it already reached a terminal stage.
     */
    public ApplicationRecord fail(String applicationId, ApplicationStage failedStage, String detail) {
        AtomicReference<ApplicationStage> from = new AtomicReference<>();
        ApplicationRecord committed = repository.update(applicationId, current -> {
            from.set(current.currentStage());
            if (current.isTerminal()) {
                return current;
            }
            Instant now = clock.instant();
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("stage", failedStage.name());
            details.put("error", detail);
            return current.fail(new StageFailure(failedStage, detail), now)
                    .appendEvent(new AgentLogEntry(now, "Workflow", "handle_error", details));
        });
        if (from.get() != committed.currentStage()) {
            notifyListeners(from.get(), committed);
        } else {
            log.debug("Application {} already terminal in {}, failure not recorded", applicationId, from.get());
        }
        return committed;
    }

    /**
     * Appends an event without changing the stage. Allowed on terminal records.
     */
    public ApplicationRecord record(String applicationId, String agent, String action, Map<String, Object> details) {
        return repository.update(applicationId,
                current -> current.appendEvent(new AgentLogEntry(clock.instant(), agent, action, details)));
    }

    private void notifyListeners(ApplicationStage from, ApplicationRecord committed) {
        for (StageTransitionListener listener : listeners) {
            try {
                listener.onTransition(from, committed);
            } catch (RuntimeException e) {
                log.warn("Transition listener {} failed for {}", listener.getClass().getSimpleName(), committed.id(), e);
            }
        }
    }
}
