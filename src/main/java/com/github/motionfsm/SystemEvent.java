package com.github.motionfsm;

/**
 * The closed set of external stimuli that may move the motion pipeline between states.
 */
public enum SystemEvent {
  START_MOVEIT("Bring up the motion planner"),
  MOVEIT_READY("Motion planner is up"),
  MOVEIT_FAILED("Motion planner failed to come up"),
  START_PLANNING("Plan again"),
  PLANNING_SUCCESS("A trajectory was found"),
  PLANNING_FAILED("No trajectory could be found"),
  EXECUTION_COMPLETE("Trajectory execution finished"),
  OBSTACLE_APPEARED("An obstacle blocks the trajectory"),
  // declared but not wired to any transition yet
  OBSTACLE_CLEARED("The obstacle is gone"),
  STOP_REQUEST("Stop whatever is in progress"),
  ERROR_OCCURRED("Unrecoverable failure reported"),
  RESET_REQUEST("Return to idle");

  private String description;

  private SystemEvent(String description) {
    this.description = description;
  }

  public String getDescription() {
    return description;
  }
}
