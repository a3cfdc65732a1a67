package com.example.querygate.config;

/**
 * Source of connection settings. Implementations are consulted once per request and must not cache.
 */
@FunctionalInterface
public interface ConnectionSettingsProvider {
    ConnectionSettings current();
}
