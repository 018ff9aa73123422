package org.latticeville.runtime.action;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks an action against the valid-target set computed for the acting agent.
 * <p>
 * Any argument that is missing or not part of the target set turns the action into
 * {@link Action#IDLE}. Rejection is a local recovery, never a failure of the run.
 * Validating an already validated action against the same targets returns it unchanged.
 */
public final class ActionValidator {

    private static final Logger LOG = LoggerFactory.getLogger(ActionValidator.class);

    private ActionValidator() {
    }

    /**
     * @param agentId The acting agent, for logging.
     * @param action  The proposed action, may be {@code null}.
     * @param targets The agent's valid targets for this tick.
     * @return The action itself if valid, otherwise {@link Action#IDLE}.
     */
    public static Action validate(String agentId, Action action, ValidTargets targets) {
        if (action == null) {
            return Action.IDLE;
        }
        String reason = rejectionReason(action, targets);
        if (reason == null) {
            return action;
        }
        LOG.debug("Rejected {} of agent {}: {}", action, agentId, reason);
        return Action.IDLE;
    }

    /**
     * @param action  The proposed action.
     * @param targets The valid targets.
     * @return Whether the action passes validation unchanged.
     */
    public static boolean isValid(Action action, ValidTargets targets) {
        return action != null && rejectionReason(action, targets) == null;
    }

    private static String rejectionReason(Action action, ValidTargets targets) {
        if (action instanceof Action.Idle) {
            return null;
        } else if (action instanceof Action.Move move) {
            if (move.toLocationId() == null || !targets.locations().contains(move.toLocationId())) {
                return "location '" + move.toLocationId() + "' is not reachable";
            }
        } else if (action instanceof Action.Interact interact) {
            if (interact.verb() == null) {
                return "missing verb";
            }
            if (interact.objectId() == null || !targets.objects().contains(interact.objectId())) {
                return "object '" + interact.objectId() + "' is not in reach";
            }
        } else if (action instanceof Action.Say say) {
            if (say.utterance() == null) {
                return "missing utterance";
            }
            if (say.toAgentId() == null || !targets.agents().contains(say.toAgentId())) {
                return "agent '" + say.toAgentId() + "' is not present";
            }
        }
        return null;
    }
}
