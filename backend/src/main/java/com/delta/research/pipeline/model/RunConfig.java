package com.delta.research.pipeline.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public record RunConfig(List<String> targetCountries) {
    public RunConfig {
        targetCountries = targetCountries == null ? List.of() : List.copyOf(targetCountries);
    }

    public static RunConfig empty() {
        return new RunConfig(List.of());
    }

    public boolean targetsCountry(String country) {
        if (country == null || country.isBlank()) {
            return false;
        }
        String normalized = country.trim().toLowerCase(Locale.ROOT);
        for (String target : targetCountries) {
            if (target != null && target.trim().toLowerCase(Locale.ROOT).equals(normalized)) {
                return true;
            }
        }
        return false;
    }

    public static RunConfig of(List<String> countries) {
        if (countries == null) {
            return empty();
        }
        List<String> out = new ArrayList<>();
        for (String country : countries) {
            if (country != null && !country.isBlank()) {
                out.add(country.trim());
            }
        }
        return new RunConfig(out);
    }
}
