package workforce.backend.scoring;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Deterministic skill matching used for assignee recommendations and skill gaps.
 * Skills compare case-insensitively after trimming.
 *
 * Recommendation rank (0..100):
 * - 50% share of the required skills the employee has
 * - 30% free capacity, max(0, 10 - open tasks) / 10
 * - 20% latest productivity score / 100
 */
public final class SkillMatcher {

    private static final double SKILL_WEIGHT = 50;
    private static final double CAPACITY_WEIGHT = 30;
    private static final double PERFORMANCE_WEIGHT = 20;
    private static final int FULL_LOAD = 10;

    private SkillMatcher() {
    }

    /**
     * Lower-cased, trimmed, de-duplicated skills in first-seen order. Blanks are dropped.
     */
    public static Set<String> normalize(Collection<String> skills) {
        Set<String> normalized = new LinkedHashSet<>();
        if (skills == null) {
            return normalized;
        }
        for (String skill : skills) {
            if (skill != null && !skill.isBlank()) {
                normalized.add(skill.trim().toLowerCase(Locale.ROOT));
            }
        }
        return normalized;
    }

    /**
     * Number of distinct required skills the employee has.
     */
    public static int overlap(Collection<String> employeeSkills, Collection<String> requiredSkills) {
        Set<String> required = normalize(requiredSkills);
        required.retainAll(normalize(employeeSkills));
        return required.size();
    }

    /**
     * Share of the required skills covered, 0 when nothing is required.
     */
    public static double overlapRate(int overlap, int requiredCount) {
        return (double) overlap / Math.max(requiredCount, 1);
    }

    public static double rank(int overlap, int requiredCount, int openTasks, double performanceScore) {
        double capacity = (double) Math.max(0, FULL_LOAD - openTasks) / FULL_LOAD;
        double performance = Math.min(Math.max(performanceScore, 0), 100) / 100;
        return overlapRate(overlap, requiredCount) * SKILL_WEIGHT
                + capacity * CAPACITY_WEIGHT
                + performance * PERFORMANCE_WEIGHT;
    }

    /**
     * Required skills the employee lacks, in the order they were first required.
     */
    public static List<String> gaps(Collection<String> employeeSkills, Collection<String> requiredSkills) {
        Set<String> have = normalize(employeeSkills);
        List<String> missing = new ArrayList<>();
        for (String skill : normalize(requiredSkills)) {
            if (!have.contains(skill)) {
                missing.add(skill);
            }
        }
        return missing;
    }

    /**
     * Share of the required skills covered, rounded to three decimals.
     * Full coverage when nothing is required.
     */
    public static double coverage(int requiredCount, int gapCount) {
        if (requiredCount == 0) {
            return 1.0;
        }
        double rate = (double) (requiredCount - gapCount) / requiredCount;
        return Math.round(rate * 1000) / 1000.0;
    }
}
