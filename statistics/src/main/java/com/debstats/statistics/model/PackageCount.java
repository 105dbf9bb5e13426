package com.debstats.statistics.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A package together with the number of files it owns in a Contents index.
 */
public record PackageCount(
        @JsonProperty("package") String name,
        @JsonProperty("files") int count
) {}
