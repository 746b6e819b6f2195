package com.lihtcmate.backend.modules.hud.domain;

import java.util.List;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.lihtcmate.backend.modules.property.domain.Property;

/**
 * Reads AMI thresholds out of a free-text compliance option such as
 * {@code "20% at 50% AMI, 55% at 80% AMI"}.
 */
public final class ComplianceOptionParser {

    private static final Pattern SET_ASIDE = Pattern.compile(
            "(\\d{1,3}(?:\\.\\d+)?)\\s*%\\s*at\\s*(\\d{1,3})(?:\\.\\d+)?\\s*%\\s*(?:of\\s*)?AMI",
            Pattern.CASE_INSENSITIVE);

    private ComplianceOptionParser() {
    }

    /**
     * Distinct AMI thresholds in ascending order. Text with no recognizable set-aside falls back to
     * {@link Property#DEFAULT_COMPLIANCE_OPTION}.
     */
    public static List<Integer> thresholds(String complianceOption) {
        List<Integer> parsed = parse(complianceOption);
        return parsed.isEmpty() ? parse(Property.DEFAULT_COMPLIANCE_OPTION) : parsed;
    }

    private static List<Integer> parse(String complianceOption) {
        if (complianceOption == null || complianceOption.isBlank()) {
            return List.of();
        }
        TreeSet<Integer> thresholds = new TreeSet<>();
        Matcher matcher = SET_ASIDE.matcher(complianceOption);
        while (matcher.find()) {
            int amiPercent = Integer.parseInt(matcher.group(2));
            if (amiPercent > 0 && amiPercent <= 140) {
                thresholds.add(amiPercent);
            }
        }
        return List.copyOf(thresholds);
    }
}
