package org.latticeville.runtime.action;

public enum ActionKind {
    IDLE,
    MOVE,
    INTERACT,
    SAY
}
