package io.github.riemr.autoschedule.presentation.controller;

import io.github.riemr.autoschedule.application.dto.AutoScheduleCommand;
import io.github.riemr.autoschedule.application.dto.AutoScheduleResult;
import io.github.riemr.autoschedule.application.dto.AutoScheduleRunRequest;
import io.github.riemr.autoschedule.application.service.AutoScheduleService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/auto-schedule")
public class AutoScheduleController {
    private final AutoScheduleService autoScheduleService;
    private final int defaultWeeksOut;

    public AutoScheduleController(AutoScheduleService autoScheduleService,
                                  @Value("${autoschedule.default-weeks-out:7}") int defaultWeeksOut) {
        this.autoScheduleService = autoScheduleService;
        this.defaultWeeksOut = defaultWeeksOut;
    }

    @PostMapping(path = "/runs", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AutoScheduleResult> run(@Valid @RequestBody AutoScheduleRunRequest req) {
        int weeksOut = req.getWeeksOut() != null ? req.getWeeksOut() : defaultWeeksOut;
        AutoScheduleResult result = autoScheduleService.run(new AutoScheduleCommand(
                req.getGroupTypeGuid(), req.getSchedulerAliasGuid(), weeksOut, req.getAutoScheduleAttributeKey()));
        return ResponseEntity.ok(result);
    }
}
