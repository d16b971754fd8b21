package com.astrolabe.service;

import java.util.Optional;

/**
 * Computes the value of one canonical field from the file's header and the fields
 * resolved so far. Returns empty when its inputs are missing.
 */
@FunctionalInterface
public interface ComputeRule {
    Optional<?> compute(ResolutionContext ctx);
}
