package com.example.storemap.controller;

import com.example.storemap.service.MapQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import static com.example.storemap.controller.MapAdminController.blocking;

@RestController
public class PublicMapController {

    private final MapQueryService mapQueryService;

    public PublicMapController(MapQueryService mapQueryService) {
        this.mapQueryService = mapQueryService;
    }

    @GetMapping("/api/stores/{storeId}/map")
    public Mono<MapQueryService.PublishedMapView> publishedMap(@PathVariable long storeId) {
        return blocking(() -> mapQueryService.getPublishedMap(storeId));
    }
}
