package org.devops.customers.rest;

/** Metadata returned from the service root. */
public record ServiceInfo(
    String name,
    String version,
    String paths
) {}
