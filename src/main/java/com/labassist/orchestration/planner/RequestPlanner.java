package com.labassist.orchestration.planner;

import com.labassist.orchestration.model.AgentPlan;

/**
 * Produces the ordered plan for a request. Any exception thrown here fails
 * the request.
 */
public interface RequestPlanner {

    AgentPlan plan(String text);
}
