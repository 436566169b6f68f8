package com.admissions.prediction.dto;

import lombok.Value;

/** {"status": "healthy"} */
@Value
public class HealthResponse {

    public static final HealthResponse HEALTHY = new HealthResponse("healthy");

    String status;
}
