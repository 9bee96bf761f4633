package com.gridt.admin.domain.model;

public enum EntityKind {
    MOVEMENTS,
    USERS,
    ASSOCIATIONS
}
