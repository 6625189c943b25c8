package com.hospital.opd.config;

/**
 * Read side of runtime configuration. Callers take one snapshot per request
 * and use it for the whole computation.
 */
public interface ConfigView {

    ConfigSnapshot snapshot();
}
