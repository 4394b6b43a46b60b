package com.acmeCables.proposalEngine.match.service;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Finds the candidate attribute that corresponds to a required attribute name.
 *
 * <p>Names are normalised (lower case, runs of non-alphanumerics collapsed to {@code _}).
 * An exact normalised match wins; otherwise the synonym groups below are consulted.</p>
 */
@Component
public class AttributeNameResolver {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");

    private static final List<Set<String>> SYNONYM_GROUPS = List.of(
            Set.of("conductor_material", "conductor", "material"),
            Set.of("conductor_size", "size", "cross_section"),
            Set.of("insulation", "insulation_type", "insulating_material"),
            Set.of("voltage", "voltage_grade", "rated_voltage", "voltage_rating"),
            Set.of("cores", "number_of_cores", "core_count", "no_of_cores")
    );

    /**
     * @return the candidate's value for the attribute, or null when it does not carry it
     */
    public String resolve(String requiredName, Map<String, String> candidateAttributes) {
        if (requiredName == null || candidateAttributes == null || candidateAttributes.isEmpty()) {
            return null;
        }
        String wanted = normalize(requiredName);

        // sorted so that a candidate with several synonymous keys resolves the same way every run
        Map<String, String> byNormalizedName = new TreeMap<>();
        new TreeMap<>(candidateAttributes).forEach(
                (name, value) -> byNormalizedName.putIfAbsent(normalize(name), value));

        String direct = byNormalizedName.get(wanted);
        if (direct != null) {
            return direct;
        }
        for (Set<String> group : SYNONYM_GROUPS) {
            if (!group.contains(wanted)) {
                continue;
            }
            for (Map.Entry<String, String> entry : byNormalizedName.entrySet()) {
                if (group.contains(entry.getKey())) {
                    return entry.getValue();
                }
            }
        }
        return null;
    }

    static String normalize(String name) {
        String collapsed = NON_ALPHANUMERIC.matcher(name.trim().toLowerCase(Locale.ROOT)).replaceAll("_");
        int start = 0;
        int end = collapsed.length();
        while (start < end && collapsed.charAt(start) == '_') {
            start++;
        }
        while (end > start && collapsed.charAt(end - 1) == '_') {
            end--;
        }
        return collapsed.substring(start, end);
    }
}
