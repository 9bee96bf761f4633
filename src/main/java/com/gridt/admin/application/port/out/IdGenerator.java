package com.gridt.admin.application.port.out;

import java.util.UUID;

/**
 * Port for generating row identifiers.
 * Identifiers are time ordered, so ordering by id is ordering by insertion.
 */
public interface IdGenerator {

    UUID generate();
}
