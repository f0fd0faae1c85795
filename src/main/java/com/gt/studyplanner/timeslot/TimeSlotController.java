package com.gt.studyplanner.timeslot;

import com.gt.studyplanner.model.TimeSlot;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/rest/timeslot")
public class TimeSlotController {

    private static final List<DayOfWeek> WEEKDAYS = List.of(
            DayOfWeek.MONDAY, DayOfWeek.TUESDAY, DayOfWeek.WEDNESDAY, DayOfWeek.THURSDAY, DayOfWeek.FRIDAY);

    private final TimeSlotOptimizer timeSlotOptimizer;

    @Autowired
    public TimeSlotController(TimeSlotOptimizer timeSlotOptimizer) {
        this.timeSlotOptimizer = timeSlotOptimizer;
    }

    @GetMapping(value = "/optimalSlots", produces = "application/json")
    public List<TimeSlot> getOptimalSlots(@RequestParam(value = "learnerId") String learnerId,
                                          @RequestParam(value = "hoursNeeded") double hoursNeeded,
                                          @RequestParam(value = "days", required = false) List<DayOfWeek> days) {
        return timeSlotOptimizer.optimalSlots(learnerId, hoursNeeded, days == null || days.isEmpty() ? WEEKDAYS : days, Instant.now());
    }
}
