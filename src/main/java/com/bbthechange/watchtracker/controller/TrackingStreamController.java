package com.bbthechange.watchtracker.controller;

import com.bbthechange.watchtracker.exception.ValidationException;
import com.bbthechange.watchtracker.service.WatchProgressService;
import com.bbthechange.watchtracker.sync.TrackingScope;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Server-Sent Events streams of watch progress. Every event carries the full
 * in-progress list for the stream's scope.
 */
@RestController
@RequestMapping("/tracking")
public class TrackingStreamController extends BaseController {

    private final WatchProgressService watchProgressService;

    @Autowired
    public TrackingStreamController(WatchProgressService watchProgressService) {
        this.watchProgressService = watchProgressService;
    }

    @GetMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamAll(HttpServletRequest httpRequest) {
        return watchProgressService.streamProgress(currentUser(httpRequest), TrackingScope.allShows());
    }

    @GetMapping(path = "/shows/{showId}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamShow(@PathVariable Integer showId, HttpServletRequest httpRequest) {
        if (showId == null || showId <= 0) {
            throw new ValidationException("Invalid show ID: " + showId);
        }
        return watchProgressService.streamProgress(currentUser(httpRequest), TrackingScope.show(showId));
    }
}
