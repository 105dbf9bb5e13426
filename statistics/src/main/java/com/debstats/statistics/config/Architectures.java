package com.debstats.statistics.config;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Architectures for which the mirror publishes a Contents index.
 * Iteration order is the listing order used in usage messages.
 */
public final class Architectures {

    public static final Set<String> SUPPORTED = Collections.unmodifiableSet(new LinkedHashSet<>(List.of(
            "all",
            "amd64",
            "arm64",
            "armel",
            "armhf",
            "i386",
            "mips64el",
            "mipsel",
            "ppc64el",
            "s390x",
            "source",
            "udeb-all",
            "udeb-amd64",
            "udeb-arm64",
            "udeb-armel",
            "udeb-armhf",
            "udeb-i386",
            "udeb-mips64el",
            "udeb-mipsel",
            "udeb-ppc64el",
            "udeb-s390x"
    )));

    private Architectures() {
    }
}
