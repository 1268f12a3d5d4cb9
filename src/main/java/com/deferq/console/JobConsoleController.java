package com.deferq.console;

import com.deferq.SchedulingInvariantViolationException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Plain text HTTP surface over {@link JobCommands}.
 */
@RestController
@RequestMapping(path = "/deferq/jobs", produces = MediaType.TEXT_PLAIN_VALUE)
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnProperty(prefix = "deferq.console", name = "enabled", havingValue = "true")
public class JobConsoleController {

    private final JobCommands jobCommands;

    public JobConsoleController(JobCommands jobCommands) {
        this.jobCommands = jobCommands;
    }

    @GetMapping
    public ResponseEntity<String> index() {
        return toResponse(jobCommands.index());
    }

    @GetMapping("/{id}")
    public ResponseEntity<String> show(@PathVariable("id") long id) {
        return toResponse(jobCommands.show(id));
    }

    @PostMapping("/{id}/run")
    public ResponseEntity<String> run(@PathVariable("id") long id) {
        return toResponse(jobCommands.run(id));
    }

    @PostMapping("/{id}/unfail")
    public ResponseEntity<String> unfail(@PathVariable("id") long id) {
        return toResponse(jobCommands.unfail(id));
    }

    @PostMapping("/{id}/unlock")
    public ResponseEntity<String> unlock(@PathVariable("id") long id) {
        return toResponse(jobCommands.unlock(id));
    }

    @ExceptionHandler(SchedulingInvariantViolationException.class)
    public ResponseEntity<String> schedulingViolation(SchedulingInvariantViolationException e) {
        return ResponseEntity.internalServerError().contentType(MediaType.TEXT_PLAIN).body(e.getMessage());
    }

    private ResponseEntity<String> toResponse(CommandResponse response) {
        return ResponseEntity.status(response.status()).contentType(MediaType.TEXT_PLAIN).body(response.text());
    }
}
