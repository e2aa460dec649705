package com.github.motionfsm;

/**
 * The closed set of states the motion pipeline can occupy.
 */
public enum SystemState {
  // waiting for work, also the state every reset lands in
  IDLE("Waiting for work"),
  // the motion planning framework is coming up
  MOVEIT_STARTING("Motion planner starting"),
  PLANNING("Planning a trajectory"),
  EXECUTING("Executing a trajectory"),
  // planning or execution was interrupted by an obstacle
  OBSTACLE_DETECTED("Obstacle detected"),
  ERROR("Pipeline failed");

  private String description;

  private SystemState(String description) {
    this.description = description;
  }

  public String getDescription() {
    return description;
  }
}
