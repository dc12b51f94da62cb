package com.example.storemap.controller;

import com.example.storemap.dto.ElementPayload;
import com.example.storemap.model.MapElement;
import com.example.storemap.service.BulkReconciler;
import com.example.storemap.service.ElementPayloadMapper;
import com.example.storemap.service.IncrementalMutator;
import com.example.storemap.service.MapQueryService;
import com.example.storemap.service.PublishStateMachine;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Editor endpoints for one store's map. Store scoping and roles are enforced upstream.
 */
@RestController
@RequestMapping("/api/admin/stores/{storeId}/map")
public class MapAdminController {

    private final MapQueryService mapQueryService;
    private final BulkReconciler bulkReconciler;
    private final IncrementalMutator incrementalMutator;
    private final PublishStateMachine publishStateMachine;
    private final ElementPayloadMapper payloadMapper;

    public MapAdminController(MapQueryService mapQueryService, BulkReconciler bulkReconciler,
                              IncrementalMutator incrementalMutator, PublishStateMachine publishStateMachine,
                              ElementPayloadMapper payloadMapper) {
        this.mapQueryService = mapQueryService;
        this.bulkReconciler = bulkReconciler;
        this.incrementalMutator = incrementalMutator;
        this.publishStateMachine = publishStateMachine;
        this.payloadMapper = payloadMapper;
    }

    @GetMapping
    public Mono<MapQueryService.MapView> getMap(@PathVariable long storeId) {
        return blocking(() -> mapQueryService.getMap(storeId));
    }

    @PostMapping("/elements")
    public Mono<BulkReconciler.SaveResult> saveElements(@PathVariable long storeId,
                                                        @RequestBody Map<String, Object> body) {
        return blocking(() -> {
            List<ElementPayload> elements = payloadMapper.readElements(body.get("elements"));
            return bulkReconciler.save(storeId, elements);
        });
    }

    @PostMapping("/element")
    public Mono<IncrementalMutator.CreateResult> createElement(@PathVariable long storeId,
                                                               @RequestBody Map<String, Object> body) {
        return blocking(() -> incrementalMutator.create(storeId, payloadMapper.readElement(body.get("element"), "element")));
    }

    @PutMapping("/element/{ref}")
    public Mono<Map<String, Object>> updateElement(@PathVariable long storeId, @PathVariable String ref,
                                                   @RequestBody Map<String, Object> body) {
        return blocking(() -> {
            MapElement updated = incrementalMutator.update(storeId, ref,
                    payloadMapper.readElement(body.get("element"), "element"));
            return Map.of("success", true, "element", updated);
        });
    }

    @DeleteMapping("/element/{ref}")
    public Mono<Map<String, Object>> deleteElement(@PathVariable long storeId, @PathVariable String ref) {
        return blocking(() -> Map.of("success", true, "elementId", incrementalMutator.delete(storeId, ref)));
    }

    @PostMapping("/image")
    public Mono<Map<String, Object>> setImage(@PathVariable long storeId, @RequestBody Map<String, Object> body) {
        return blocking(() -> {
            Object imageUrl = body.get("imageUrl");
            mapQueryService.setMapImage(storeId, imageUrl == null ? null : imageUrl.toString());
            return Map.of("success", true, "imageUrl", imageUrl);
        });
    }

    @DeleteMapping("/image")
    public Mono<Map<String, Object>> clearMap(@PathVariable long storeId) {
        return blocking(() -> Map.of("success", true, "removedElements", mapQueryService.clearMap(storeId)));
    }

    @GetMapping("/status")
    public Mono<PublishStateMachine.PublishStatus> status(@PathVariable long storeId) {
        return blocking(() -> publishStateMachine.status(storeId));
    }

    @PostMapping("/publish")
    public Mono<PublishStateMachine.PublishResult> publish(@PathVariable long storeId) {
        return blocking(() -> publishStateMachine.publish(storeId));
    }

    static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
