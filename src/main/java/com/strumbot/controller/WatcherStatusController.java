package com.strumbot.controller;

import com.strumbot.dto.WatcherStatus;
import com.strumbot.service.StreamWatchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Internal view of the watchers, for operators.
 *
 * The polling service is optional: with strumbot.polling.enabled=false the endpoints
 * answer 503.
 */
@RestController
@RequestMapping("/internal/watchers")
public class WatcherStatusController {

    private static final Logger logger = LoggerFactory.getLogger(WatcherStatusController.class);

    private final Optional<StreamWatchService> watchService;

    public WatcherStatusController(Optional<StreamWatchService> watchService) {
        this.watchService = watchService;
    }

    @GetMapping
    public ResponseEntity<?> getWatchers() {
        if (watchService.isEmpty()) {
            return pollingDisabled();
        }
        List<WatcherStatus> statuses = watchService.get().getStatuses();
        return ResponseEntity.ok(statuses);
    }

    @GetMapping("/{login}")
    public ResponseEntity<?> getWatcher(@PathVariable("login") String login) {
        if (watchService.isEmpty()) {
            return pollingDisabled();
        }
        return watchService.get().getStatus(login)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("error", "Channel not watched: " + login)));
    }

    /**
     * Poll every channel now instead of waiting for the next timer fire.
     */
    @PostMapping("/poll")
    public ResponseEntity<?> triggerPoll() {
        logger.info("Received trigger-poll request");
        if (watchService.isEmpty()) {
            return pollingDisabled();
        }
        int channels = watchService.get().pollAll();
        return ResponseEntity.accepted().body(Map.of(
                "status", "requested",
                "channels", channels
        ));
    }

    private ResponseEntity<?> pollingDisabled() {
        logger.warn("Watch service not available - strumbot.polling.enabled=false");
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of(
                "error", "Polling not enabled",
                "hint", "Set strumbot.polling.enabled=true to enable polling"
        ));
    }
}
