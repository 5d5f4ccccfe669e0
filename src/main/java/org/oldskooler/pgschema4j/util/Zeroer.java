package org.oldskooler.pgschema4j.util;

/**
 * Implemented by value types that define their own notion of "not set".
 * Zero values are skipped by inserts, full updates and exists probes.
 */
public interface Zeroer {
    boolean isZero();
}
