package net.jobsy.app.web;

import net.jobsy.app.service.JobQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/jobs")
public class JobController {
    private final JobQueryService service;

    public JobController(JobQueryService service) {
        this.service = service;
    }

    @GetMapping
    public List<JobViews.JobSummary> list() throws Exception {
        return service.list();
    }

    @GetMapping("/{id}")
    public JobViews.JobDetail detail(@PathVariable("id") UUID id) throws Exception {
        return service.detail(id);
    }

    /** Report submission used by monitored jobs: plain-text {@code OK} or {@code ERROR}. */
    @PostMapping("/{id}")
    public ResponseEntity<String> report(@PathVariable("id") UUID id,
                                         @RequestParam(name = "status", required = false) String status) throws Exception {
        if (status == null || status.isBlank()) {
            return ResponseEntity.badRequest().body("ERROR");
        }
        service.submitReport(id, status);
        return ResponseEntity.ok("OK");
    }

    @PostMapping("/{id}/check")
    public JobViews.CheckResult check(@PathVariable("id") UUID id) throws Exception {
        return service.check(id);
    }
}
