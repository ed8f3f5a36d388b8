package com.eainde.policylens.engine;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Case-insensitive set of high-risk jurisdictions (names or ISO codes).
 */
public final class HighRiskCountries {

    private final Set<String> countries;

    public HighRiskCountries(Collection<String> countries) {
        this.countries = countries.stream()
                .filter(c -> c != null && !c.isBlank())
                .map(HighRiskCountries::normalize)
                .collect(Collectors.toUnmodifiableSet());
    }

    public boolean contains(String country) {
        return country != null && countries.contains(normalize(country));
    }

    private static String normalize(String country) {
        return country.strip().toLowerCase(Locale.ROOT);
    }
}
