package com.admissions.prediction.controller;

import com.admissions.prediction.dto.HealthResponse;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

/**
 * HealthController - Liveness endpoint.
 *
 * Endpoints:
 * - GET /health  - Always {"status": "healthy"}
 * - POST /health - Same, for probes that only issue POST
 *
 * Not behind the bearer interceptor; it reports process liveness only and
 * never touches the model.
 */
@RestController
public class HealthController {

    /**
     * @return the constant healthy status
     */
    @RequestMapping(path = "/health", method = {RequestMethod.GET, RequestMethod.POST})
    public HealthResponse health() {
        return HealthResponse.HEALTHY;
    }
}
