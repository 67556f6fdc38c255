package com.pickshot.controller;

import com.pickshot.service.RatingReconciler.RatingsRefreshedEvent;
import com.pickshot.service.ThumbnailService.ThumbnailsReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * SSE stream of background completions.
 *
 * GET /api/events: events "thumbnails-ready" ({id, thumbnailUrl,
 * thumbnailRetinaUrl}) and "ratings-refreshed" ({ratings: {id: rating}}).
 * Events are not ordered relative to request responses; clients apply them
 * by photo id.
 */
@RestController
@RequestMapping("/api/events")
public class PhotoEventsController {

    // Active SSE clients
    private final List<SseEmitter> sseClients = new CopyOnWriteArrayList<>();

    @GetMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter subscribe() {
        SseEmitter emitter = new SseEmitter(0L); // no timeout
        sseClients.add(emitter);

        emitter.onCompletion(() -> sseClients.remove(emitter));
        emitter.onTimeout(() -> sseClients.remove(emitter));
        emitter.onError(e -> sseClients.remove(emitter));
        return emitter;
    }

    @EventListener
    public void onThumbnailsReady(ThumbnailsReadyEvent event) {
        broadcast("thumbnails-ready", Map.of(
                "id", event.getPhotoId(),
                "thumbnailUrl", event.getThumbnailUrl(),
                "thumbnailRetinaUrl", event.getThumbnailRetinaUrl()));
    }

    @EventListener
    public void onRatingsRefreshed(RatingsRefreshedEvent event) {
        broadcast("ratings-refreshed", Map.of("ratings", event.getRatings()));
    }

    int getClientCount() {
        return sseClients.size();
    }

    private void broadcast(String name, Object data) {
        if (sseClients.isEmpty())
            return;

        List<SseEmitter> dead = new CopyOnWriteArrayList<>();
        for (SseEmitter emitter : sseClients) {
            try {
                emitter.send(SseEmitter.event().name(name).data(data));
            } catch (IOException | IllegalStateException e) {
                dead.add(emitter);
            }
        }
        sseClients.removeAll(dead);
    }
}
