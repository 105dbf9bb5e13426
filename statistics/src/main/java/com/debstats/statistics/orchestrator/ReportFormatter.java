package com.debstats.statistics.orchestrator;

import com.debstats.statistics.model.PackageCount;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.List;

/**
 * Renders selected packages either as a fixed-width table or as JSON.
 */
public class ReportFormatter {

    private static final String PACKAGE_HEADER = "PACKAGE";
    private static final String FILES_HEADER = "FILES";

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * One row per package: rank, name padded to the longest name, file count.
     */
    public String table(List<PackageCount> packages) {
        int nameWidth = PACKAGE_HEADER.length();
        int rankWidth = Math.max(1, String.valueOf(packages.size()).length()) + 1;
        for (PackageCount pkg : packages) {
            nameWidth = Math.max(nameWidth, pkg.name().length());
        }

        String format = "%-" + rankWidth + "s  %-" + nameWidth + "s  %s%n";
        StringBuilder out = new StringBuilder();
        out.append(String.format(format, "#", PACKAGE_HEADER, FILES_HEADER));
        int rank = 1;
        for (PackageCount pkg : packages) {
            out.append(String.format(format, rank++ + ".", pkg.name(), pkg.count()));
        }
        return out.toString();
    }

    public String json(List<PackageCount> packages) throws JsonProcessingException {
        return objectMapper.writeValueAsString(packages);
    }
}
