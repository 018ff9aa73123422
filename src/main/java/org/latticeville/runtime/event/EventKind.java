package org.latticeville.runtime.event;

public enum EventKind {
    MOVE,
    OBJECT_STATE_CHANGED,
    SAY,
    WEATHER_CHANGED,
    TIME_ADVANCED
}
