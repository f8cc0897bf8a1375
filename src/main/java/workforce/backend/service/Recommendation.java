package workforce.backend.service;

import workforce.backend.model.Employee;

/**
 * One ranked candidate for a task.
 *
 * @param matchedSkills    distinct required skills the employee has
 * @param matchRate        matchedSkills / required skills
 * @param openTasks        active tasks not yet completed
 * @param performanceScore latest productivity score, or the neutral default when never scored
 * @param rank             composite fit, 0..100
 */
public record Recommendation(
        Employee employee,
        int matchedSkills,
        double matchRate,
        int openTasks,
        double performanceScore,
        double rank) {
}
