package org.latticeville.runtime.action;

/**
 * The single action an agent chooses per tick.
 * <p>
 * A closed hierarchy so that validation and execution can switch over it exhaustively.
 */
public sealed interface Action permits Action.Idle, Action.Move, Action.Interact, Action.Say {

    /** The shared idle action. */
    Idle IDLE = new Idle();

    /**
     * @return The action kind.
     */
    ActionKind kind();

    /**
     * Do nothing this tick. Always valid.
     */
    record Idle() implements Action {
        @Override
        public ActionKind kind() {
            return ActionKind.IDLE;
        }
    }

    /**
     * Start travelling to a location.
     *
     * @param toLocationId The destination area.
     */
    record Move(String toLocationId) implements Action {
        @Override
        public ActionKind kind() {
            return ActionKind.MOVE;
        }
    }

    /**
     * Apply a verb to an object in the current area.
     *
     * @param objectId The target object.
     * @param verb     The verb.
     */
    record Interact(String objectId, Verb verb) implements Action {
        @Override
        public ActionKind kind() {
            return ActionKind.INTERACT;
        }
    }

    /**
     * Speak to another agent in the current area.
     *
     * @param toAgentId The addressee.
     * @param utterance What is said.
     */
    record Say(String toAgentId, String utterance) implements Action {
        @Override
        public ActionKind kind() {
            return ActionKind.SAY;
        }
    }
}
