package com.rescontrol.api;

import com.rescontrol.admission.AdmissionEngine;
import com.rescontrol.contract.Resource;
import com.rescontrol.contract.UsageRequest;
import com.rescontrol.observer.AsyncObserverHook;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Synchronous request/response surface of the admission engine.
 *
 * POST /v1/resources/for-event
 * POST /v1/resources/authorize
 * POST /v1/resources/allocate
 * POST /v1/resources/release
 * GET  /v1/resources/{tenant}/{id}
 * GET  /v1/resources/stream
 */
@RestController
@RequestMapping("/v1/resources")
public class ResourceController {

    private final AdmissionEngine admissionEngine;
    private final AsyncObserverHook observerHook;

    public ResourceController(AdmissionEngine admissionEngine, AsyncObserverHook observerHook) {
        this.admissionEngine = admissionEngine;
        this.observerHook = observerHook;
    }

    @PostMapping("/for-event")
    public List<Resource> resourcesForEvent(@RequestBody UsageRequest request) {
        return admissionEngine.getResourcesForEvent(request);
    }

    @PostMapping("/authorize")
    public Map<String, Object> authorize(@RequestBody UsageRequest request) {
        return Map.of("allocation_message", admissionEngine.authorize(request));
    }

    @PostMapping("/allocate")
    public Map<String, Object> allocate(@RequestBody UsageRequest request) {
        return Map.of("allocation_message", admissionEngine.allocate(request));
    }

    @PostMapping("/release")
    public Map<String, Object> release(@RequestBody UsageRequest request) {
        admissionEngine.release(request);
        return Map.of("status", "OK");
    }

    @GetMapping("/{tenant}/{id}")
    public Resource resource(@PathVariable String tenant, @PathVariable String id) {
        return admissionEngine.getResource(tenant, id);
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestParam(required = false) String tenant) {
        SseEmitter emitter = new SseEmitter(0L);
        String subscriptionId = observerHook.subscribe(event -> {
            if (tenant != null && !tenant.equals(event.tenant())) {
                return;
            }
            try {
                emitter.send(SseEmitter.event()
                    .name("resource")
                    .data(event));
            } catch (IOException ex) {
                emitter.completeWithError(ex);
            }
        });

        emitter.onCompletion(() -> observerHook.unsubscribe(subscriptionId));
        emitter.onTimeout(() -> observerHook.unsubscribe(subscriptionId));
        emitter.onError(ex -> observerHook.unsubscribe(subscriptionId));
        return emitter;
    }
}
