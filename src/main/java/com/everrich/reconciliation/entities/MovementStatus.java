package com.everrich.reconciliation.entities;

/**
 * Lifecycle of an imported bank movement. Movements are never deleted.
 */
public enum MovementStatus {
    ACTIVE,
    CANCELLED
}
