package com.mchekin.runnerdispatch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FleetStatusResponse {

    private int running;
    private int pending;
    private int total;
    private int ceiling;
}
