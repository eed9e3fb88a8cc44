package io.fleetmesh.links;

public enum LinkAccess {
    GRANTED,
    NOT_FOUND,
    INACTIVE,
    LOGIN_REQUIRED
}
