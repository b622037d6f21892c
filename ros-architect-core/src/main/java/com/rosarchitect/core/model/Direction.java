package com.rosarchitect.core.model;

/**
 * Role a node plays on one of its interfaces.
 *
 * <p>Topics use {@link #PUBLISH} and {@link #SUBSCRIBE}; services and actions use
 * {@link #PROVIDE} and {@link #CALL}; parameters use {@link #OWN}, {@link #READ}
 * and {@link #WRITE}.
 */
public enum Direction {
    PUBLISH,
    SUBSCRIBE,
    PROVIDE,
    CALL,
    OWN,
    READ,
    WRITE;

    /**
     * Checks whether this direction may be used with the given interface kind.
     *
     * @param kind interface kind
     * @return true if the combination is meaningful
     */
    public boolean appliesTo(InterfaceKind kind) {
        return switch (kind) {
            case TOPIC -> this == PUBLISH || this == SUBSCRIBE;
            case SERVICE, ACTION -> this == PROVIDE || this == CALL;
            case PARAMETER -> this == OWN || this == READ || this == WRITE;
        };
    }
}
