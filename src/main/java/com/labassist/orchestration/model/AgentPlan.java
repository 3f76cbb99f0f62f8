package com.labassist.orchestration.model;

import java.util.List;

/**
 * Ordered plan produced for a request. Step numbers start at 1 and strictly
 * increase; the order given is the order executed.
 */
public record AgentPlan(
        String reasoning,
        List<PlanStep> steps
) {

    public AgentPlan {
        steps = steps == null ? List.of() : List.copyOf(steps);
        int previous = 0;
        for (PlanStep step : steps) {
            if (step.stepNumber() < 1 || step.stepNumber() <= previous) {
                throw new IllegalArgumentException("Plan step numbers must start at 1 and strictly increase, got "
                        + step.stepNumber() + " after " + previous);
            }
            previous = step.stepNumber();
        }
    }
}
