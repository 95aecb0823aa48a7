package com.gt.practice.schedule;

import com.gt.practice.model.ReviewForecast;
import com.gt.practice.model.SchedulingRecord;
import com.gt.practice.model.SchedulingStatistics;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/rest/schedule")
public class SchedulingController {

    private final SchedulingRecordService schedulingRecordService;

    public SchedulingController(SchedulingRecordService schedulingRecordService) {
        this.schedulingRecordService = schedulingRecordService;
    }

    @GetMapping(value = "/forecast", produces = "application/json")
    public List<ReviewForecast> getReviewForecast(@RequestParam(value = "learnerId") String learnerId,
                                                  @RequestParam(value = "days", defaultValue = "7") int days) {
        return schedulingRecordService.getReviewForecast(learnerId, days, Instant.now());
    }

    @GetMapping(value = "/statistics", produces = "application/json")
    public SchedulingStatistics getStatistics(@RequestParam(value = "learnerId") String learnerId) {
        return schedulingRecordService.getStatistics(learnerId, Instant.now());
    }

    @PostMapping(value = "/reschedule", consumes = "application/json", produces = "application/json")
    public SchedulingRecord rescheduleItem(@RequestBody RescheduleRequest request) {
        return schedulingRecordService.rescheduleItem(request.learnerId(), request.itemId(), request.nextDueAt());
    }

    private record RescheduleRequest(String learnerId, String itemId, Instant nextDueAt) { }
}
