package com.cidery.ledger.application.statemachine;

import com.cidery.ledger.domain.enums.VesselStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * State machine for vessel lifecycle management
 *
 * - AVAILABLE: empty and ready to receive liquid
 * - OCCUPIED: holds a batch
 * - CLEANING: empty, being cleaned
 * - MAINTENANCE: out of service, may still hold liquid
 * - RETIRED: terminal
 *
 * Cleaning after a vessel empties is the intended workflow but is not enforced here.
 */
@Component
public class VesselStateMachine {

    private static final Logger log = LoggerFactory.getLogger(VesselStateMachine.class);

    public enum Event {
        FILL,                // liquid arrives (assign, transfer in, blend in, split in)
        DRAIN,               // last liquid left the vessel
        START_CLEANING,
        FINISH_CLEANING,
        START_MAINTENANCE,
        FINISH_MAINTENANCE,
        RETIRE
    }

    /**
     * Result of a state transition attempt
     */
    public static class TransitionResult {
        private final VesselStatus newState;
        private final boolean valid;
        private final String errorMessage;
        private final boolean stateChanged;

        private TransitionResult(VesselStatus newState, boolean valid, String errorMessage, boolean stateChanged) {
            this.newState = newState;
            this.valid = valid;
            this.errorMessage = errorMessage;
            this.stateChanged = stateChanged;
        }

        public static TransitionResult success(VesselStatus current, VesselStatus newState) {
            return new TransitionResult(newState, true, null, current != newState);
        }

        public static TransitionResult failure(String errorMessage) {
            return new TransitionResult(null, false, errorMessage, false);
        }

        public VesselStatus getNewState() {
            return newState;
        }

        public boolean isValid() {
            return valid;
        }

        public String getErrorMessage() {
            return errorMessage;
        }

        public boolean isStateChanged() {
            return stateChanged;
        }
    }

    /**
     * Attempt a transition.
     *
     * @param current current vessel status
     * @param event what happened to the vessel
     * @param empty whether the vessel holds no liquid after the event
     */
    public TransitionResult transition(VesselStatus current, Event event, boolean empty) {
        log.debug("Vessel transition: {} + {} (empty: {})", current, event, empty);

        if (current == null || event == null) {
            return TransitionResult.failure("Current status and event are required");
        }
        if (current == VesselStatus.RETIRED) {
            return TransitionResult.failure("Vessel is retired");
        }

        return switch (event) {
            case FILL -> switch (current) {
                case AVAILABLE, OCCUPIED -> TransitionResult.success(current, VesselStatus.OCCUPIED);
                default -> TransitionResult.failure(
                        String.format("Vessel cannot receive liquid while %s", current));
            };
            case DRAIN -> {
                if (!empty) {
                    yield TransitionResult.failure("Vessel still holds liquid");
                }
                yield current == VesselStatus.OCCUPIED
                        ? TransitionResult.success(current, VesselStatus.AVAILABLE)
                        : TransitionResult.success(current, current);
            }
            case START_CLEANING -> {
                if (!empty) {
                    yield TransitionResult.failure("Vessel must be empty before cleaning");
                }
                yield current == VesselStatus.CLEANING
                        ? TransitionResult.failure("Vessel is already being cleaned")
                        : TransitionResult.success(current, VesselStatus.CLEANING);
            }
            case FINISH_CLEANING -> current == VesselStatus.CLEANING
                    ? TransitionResult.success(current, VesselStatus.AVAILABLE)
                    : TransitionResult.failure(String.format("Vessel is %s, not CLEANING", current));
            case START_MAINTENANCE -> current == VesselStatus.MAINTENANCE
                    ? TransitionResult.failure("Vessel is already in maintenance")
                    : TransitionResult.success(current, VesselStatus.MAINTENANCE);
            case FINISH_MAINTENANCE -> current == VesselStatus.MAINTENANCE
                    ? TransitionResult.success(current, empty ? VesselStatus.AVAILABLE : VesselStatus.OCCUPIED)
                    : TransitionResult.failure(String.format("Vessel is %s, not MAINTENANCE", current));
            case RETIRE -> empty
                    ? TransitionResult.success(current, VesselStatus.RETIRED)
                    : TransitionResult.failure("Vessel must be empty before it is retired");
        };
    }

    /**
     * Event that moves a vessel from {@code current} to an operator-requested {@code target}.
     * Returns null when no operator action leads there (OCCUPIED is only reached by receiving liquid).
     */
    public Event eventFor(VesselStatus current, VesselStatus target) {
        if (target == null) {
            return null;
        }
        return switch (target) {
            case AVAILABLE -> switch (current) {
                case CLEANING -> Event.FINISH_CLEANING;
                case MAINTENANCE -> Event.FINISH_MAINTENANCE;
                case OCCUPIED -> Event.DRAIN;
                default -> null;
            };
            case CLEANING -> Event.START_CLEANING;
            case MAINTENANCE -> Event.START_MAINTENANCE;
            case RETIRED -> Event.RETIRE;
            case OCCUPIED -> null;
        };
    }
}
