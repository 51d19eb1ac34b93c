package org.mides.pooling.controller;

import jakarta.validation.Valid;
import org.mides.pooling.data.RequestFactory;
import org.mides.pooling.model.GraspResult;
import org.mides.pooling.model.Problem;
import org.mides.pooling.service.IGraspService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

@Validated
@RestController
@CrossOrigin(origins = "*")
@RequestMapping("pooling/v1")
public class PoolingController {

    private final IGraspService graspService;
    private final ExecutorService executorService;

    @Autowired
    public PoolingController(IGraspService graspService, ExecutorService executorService) {
        this.graspService = graspService;
        this.executorService = executorService;
    }

    @PostMapping("/solve")
    public CompletableFuture<ResponseEntity<GraspResult>> solve(@RequestBody @Valid Problem problem) {
        var parameters = problem.getParameters() != null
            ? problem.getParameters()
            : graspService.defaultParameters();
        parameters.validate();

        var requests = new RequestFactory(parameters).create(problem.getTrips());

        return CompletableFuture
            .supplyAsync(() -> graspService.solve(requests, parameters), executorService)
            .thenApply(ResponseEntity::ok);
    }
}
