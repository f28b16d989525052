package com.github.passthrough.server.controllers;

import com.github.passthrough.backend.stream.StreamService;
import com.github.passthrough.backend.stream.models.StreamResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/stream")
@RequiredArgsConstructor
public class StreamController {
    private final StreamService streamService;

    @RequestMapping(value = "/{type}/{id}.json", method = RequestMethod.GET)
    public StreamResponse streams(@PathVariable String type, @PathVariable String id) {
        log.trace("Received stream request for {} {}", type, id);
        return streamService.resolveStreams(type, id);
    }
}
