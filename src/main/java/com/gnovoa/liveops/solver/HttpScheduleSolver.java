package com.gnovoa.liveops.solver;

import com.gnovoa.liveops.core.SolverFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/** Calls the optimizer's {@code POST /schedule} endpoint. */
public final class HttpScheduleSolver implements ScheduleSolver {

    private static final Logger log = LoggerFactory.getLogger(HttpScheduleSolver.class);

    private final RestClient restClient;

    public HttpScheduleSolver(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public SolveResponse solve(SolveRequest request) {
        log.info("Requesting schedule for {} matches ({} frozen/pinned hints)",
                request.matches().size(), request.previousAssignments().size());
        try {
            SolveResponse response = restClient.post()
                    .uri("/schedule")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(SolveResponse.class);
            if (response == null) {
                throw new SolverFailureException("Solver returned an empty body", null);
            }
            log.info("Solver answered {} in {} ms (moved={}, locked={})",
                    response.status(), response.runtimeMs(), response.movedCount(), response.lockedCount());
            return response;
        } catch (RestClientException e) {
            throw new SolverFailureException("Solver call failed: " + e.getMessage(), e);
        }
    }
}
