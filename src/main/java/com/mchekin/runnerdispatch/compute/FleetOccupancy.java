package com.mchekin.runnerdispatch.compute;

public record FleetOccupancy(int running, int pending) {

    public int total() {
        return running + pending;
    }
}
