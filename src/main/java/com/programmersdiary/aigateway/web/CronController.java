package com.programmersdiary.aigateway.web;

import com.programmersdiary.aigateway.cron.CronAnnouncement;
import com.programmersdiary.aigateway.cron.CronJob;
import com.programmersdiary.aigateway.cron.CronRunLogEntry;
import com.programmersdiary.aigateway.cron.CronScheduleException;
import com.programmersdiary.aigateway.cron.CronService;
import com.programmersdiary.aigateway.cron.CronStatus;
import com.programmersdiary.aigateway.cron.CronStoreCorruptException;
import com.programmersdiary.aigateway.cron.ManualRunResult;
import com.programmersdiary.aigateway.delivery.AnnouncementQueue;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/cron")
public class CronController {

    private final CronService cronService;
    private final AnnouncementQueue announcementQueue;

    public CronController(CronService cronService, AnnouncementQueue announcementQueue) {
        this.cronService = cronService;
        this.announcementQueue = announcementQueue;
    }

    @GetMapping("/jobs")
    public List<CronJob> listJobs(@RequestParam(defaultValue = "false") boolean includeDisabled) {
        return cronService.list(includeDisabled);
    }

    @GetMapping("/jobs/{id}")
    public CronJob getJob(@PathVariable String id) {
        return cronService.get(id).orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND));
    }

    @PostMapping("/jobs")
    @ResponseStatus(HttpStatus.CREATED)
    public CronJob createJob(@RequestBody CreateCronJobRequest request) {
        try {
            return cronService.add(request.toDraft());
        } catch (CronScheduleException | IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    @PutMapping("/jobs/{id}/enabled")
    public CronJob setEnabled(@PathVariable String id, @RequestBody Map<String, Boolean> body) {
        var enabled = body.get("enabled");
        if (enabled == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "'enabled' is required");
        }
        return cronService.setEnabled(id, enabled)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND));
    }

    @DeleteMapping("/jobs/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteJob(@PathVariable String id) {
        if (!cronService.remove(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND);
        }
    }

    @PostMapping("/jobs/{id}/run")
    public ManualRunResult runJob(@PathVariable String id, @RequestParam(defaultValue = "false") boolean force) {
        var result = cronService.runNow(id, force);
        if (!result.ran() && "not-found".equals(result.reason())) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND);
        }
        return result;
    }

    @GetMapping("/jobs/{id}/runs")
    public List<CronRunLogEntry> runs(@PathVariable String id, @RequestParam(defaultValue = "50") int limit) {
        return cronService.runs(id, limit);
    }

    @GetMapping("/status")
    public CronStatus status() {
        return cronService.status();
    }

    @GetMapping("/announcements")
    public List<CronAnnouncement> drainAnnouncements() {
        return announcementQueue.drain();
    }

    @ExceptionHandler(CronStoreCorruptException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, String> storeCorrupt(CronStoreCorruptException e) {
        return Map.of("error", e.getMessage());
    }
}
