package at.sv.celestial.event;

public enum EventType {
    RISE,
    SET
}
