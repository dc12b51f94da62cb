package com.example.storemap.controller;

import com.example.storemap.exception.ValidationException;
import com.example.storemap.service.LinkSynchronizer;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.example.storemap.controller.MapAdminController.blocking;

@RestController
@RequestMapping("/api/admin/stores/{storeId}/pins/{pinRef}")
public class PinLinkController {

    private final LinkSynchronizer linkSynchronizer;

    public PinLinkController(LinkSynchronizer linkSynchronizer) {
        this.linkSynchronizer = linkSynchronizer;
    }

    @GetMapping("/products")
    public Mono<Map<String, Object>> linkedProducts(@PathVariable long storeId, @PathVariable String pinRef) {
        return blocking(() -> Map.of("products", linkSynchronizer.listLinkedProducts(storeId, pinRef)));
    }

    @GetMapping("/products/all")
    public Mono<Map<String, Object>> allProducts(@PathVariable long storeId, @PathVariable String pinRef,
                                                 @RequestParam(required = false) String search,
                                                 @RequestParam(required = false) Integer limit) {
        return blocking(() -> Map.of("products", linkSynchronizer.listProducts(storeId, pinRef, search, limit)));
    }

    @PostMapping("/link")
    public Mono<LinkSynchronizer.LinkResult> link(@PathVariable long storeId, @PathVariable String pinRef,
                                                  @RequestBody Map<String, Object> body) {
        return blocking(() -> linkSynchronizer.link(storeId, pinRef, productIds(body, false)));
    }

    @PostMapping("/unlink")
    public Mono<LinkSynchronizer.LinkResult> unlink(@PathVariable long storeId, @PathVariable String pinRef,
                                                    @RequestBody Map<String, Object> body) {
        return blocking(() -> linkSynchronizer.unlink(storeId, pinRef, productIds(body, false)));
    }

    @PutMapping("/products")
    public Mono<LinkSynchronizer.LinkResult> sync(@PathVariable long storeId, @PathVariable String pinRef,
                                                  @RequestBody Map<String, Object> body) {
        return blocking(() -> linkSynchronizer.sync(storeId, pinRef, productIds(body, true)));
    }

    /**
     * Accepts {@code productId}, {@code productIds}, or both.
     */
    static List<Long> productIds(Map<String, Object> body, boolean listRequired) {
        Object single = body.get("productId");
        Object many = body.get("productIds");
        if (many == null && (listRequired || single == null)) {
            throw new ValidationException(listRequired ? "productIds must be an array" : "productId or productIds is required");
        }
        List<Long> ids = new ArrayList<>();
        if (single != null) {
            ids.add(toProductId(single));
        }
        if (many != null) {
            if (!(many instanceof List<?> list)) {
                throw new ValidationException("productIds must be an array");
            }
            for (Object value : list) {
                ids.add(toProductId(value));
            }
        }
        return ids;
    }

    private static Long toProductId(Object value) {
        if (value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        if (value instanceof String text) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                throw new ValidationException("Invalid product id: " + text);
            }
        }
        throw new ValidationException("Invalid product id: " + value);
    }
}
