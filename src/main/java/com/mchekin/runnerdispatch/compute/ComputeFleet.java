package com.mchekin.runnerdispatch.compute;

import java.util.Map;

/**
 * The compute control plane that hosts runner tasks of one task family.
 */
public interface ComputeFleet {

    /**
     * Running plus pending tasks of the family.
     */
    FleetOccupancy occupancy();

    /**
     * Launches one runner task with the given container environment and returns its handle.
     *
     * @throws ComputeLaunchException if the control plane refuses or fails the launch
     */
    String launch(Map<String, String> environment);
}
