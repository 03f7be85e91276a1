package com.hindsight.setforget.controller;

import com.hindsight.setforget.model.OptimalSquadMember;
import com.hindsight.setforget.service.OptimalSquadService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/squads")
@CrossOrigin(origins = "*")
public class OptimalSquadController {

    private final OptimalSquadService optimalSquadService;

    public OptimalSquadController(OptimalSquadService optimalSquadService) {
        this.optimalSquadService = optimalSquadService;
    }

    @GetMapping("/{season}")
    public List<OptimalSquadMember> latest(@PathVariable String season) {
        List<OptimalSquadMember> rows = optimalSquadService.latestForSeason(season);
        if (rows.isEmpty()) throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No stored squad for season " + season);
        return rows;
    }

    @GetMapping("/jobs/{jobId}")
    public List<OptimalSquadMember> forJob(@PathVariable String jobId) {
        List<OptimalSquadMember> rows = optimalSquadService.forJob(jobId);
        if (rows.isEmpty()) throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No stored squad for job " + jobId);
        return rows;
    }
}
