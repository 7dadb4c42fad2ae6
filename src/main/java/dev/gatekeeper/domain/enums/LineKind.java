package dev.gatekeeper.domain.enums;

public enum LineKind {
    CONTEXT, ADDED, REMOVED
}
