package com.example.storemap.service;

import com.example.storemap.dto.ElementPayload;
import com.example.storemap.exception.ValidationException;
import com.example.storemap.model.ElementMetadata;
import com.example.storemap.model.MapElement;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns editor payloads into map elements.
 *
 * <p>Columns come from the dedicated payload fields; everything else (the payload's own
 * {@code metadata} plus its loose properties) is folded into one {@link ElementMetadata}.
 * Rollup keys are owned by the link synchronizer and never taken from a payload.</p>
 */
@Component
public class ElementPayloadMapper {

    private final ObjectMapper objectMapper;

    public ElementPayloadMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<ElementPayload> readElements(Object raw) {
        if (!(raw instanceof List<?> list)) {
            throw new ValidationException("Elements must be an array");
        }
        List<ElementPayload> payloads = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            payloads.add(readElement(list.get(i), "elements[" + i + "]"));
        }
        return payloads;
    }

    public ElementPayload readElement(Object raw, String field) {
        if (!(raw instanceof Map<?, ?>)) {
            throw new ValidationException(field + " must be an object");
        }
        try {
            return objectMapper.convertValue(raw, ElementPayload.class);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(field + " is malformed: " + e.getMessage());
        }
    }

    /**
     * Checks the fields a new row cannot do without.
     */
    public void validateForInsert(ElementPayload payload, String field) {
        if (payload == null) {
            throw new ValidationException(field + " is required");
        }
        if (payload.getType() == null || payload.getType().isBlank()) {
            throw new ValidationException(field + ".type is required");
        }
        requireCoordinate(payload.getX(), field + ".x");
        requireCoordinate(payload.getY(), field + ".y");
        requireCoordinate(payload.getWidth(), field + ".width");
        requireCoordinate(payload.getHeight(), field + ".height");
    }

    private static void requireCoordinate(Double value, String field) {
        if (value == null) {
            throw new ValidationException(field + " is required");
        }
        if (value.isNaN() || value.isInfinite()) {
            throw new ValidationException(field + " must be a finite number");
        }
    }

    /**
     * The token carried by the payload itself, either top level or inside its metadata.
     */
    public String tokenOf(ElementPayload payload) {
        if (payload.getToken() != null && !payload.getToken().isBlank()) {
            return payload.getToken();
        }
        if (payload.getMetadata() != null) {
            Object token = payload.getMetadata().get("token");
            if (token != null && !token.toString().isBlank()) {
                return token.toString();
            }
        }
        return null;
    }

    /**
     * Builds an unpublished element row; id and timestamps are left to the store.
     */
    public MapElement toElement(long storeId, ElementPayload payload, String token) {
        ElementMetadata metadata = toMetadata(payload);
        metadata.setToken(token);
        metadata.setType(payload.getType());
        metadata.applyRollup(null);
        return MapElement.builder()
                .storeId(storeId)
                .type(payload.getType())
                .name(payload.getName())
                .x(payload.getX())
                .y(payload.getY())
                .width(payload.getWidth())
                .height(payload.getHeight())
                .zIndex(payload.getZIndex() == null ? 0 : payload.getZIndex())
                .colorPrimary(colorOf(payload))
                .metadata(metadata)
                .published(false)
                .build();
    }

    /**
     * Applies the fields present in {@code payload} to {@code element}. Metadata is
     * merged key by key, so properties this caller does not know about survive.
     */
    public void applyUpdate(MapElement element, ElementPayload payload) {
        if (payload.getType() != null) element.setType(payload.getType());
        if (payload.getName() != null) element.setName(payload.getName());
        if (payload.getX() != null) element.setX(payload.getX());
        if (payload.getY() != null) element.setY(payload.getY());
        if (payload.getWidth() != null) element.setWidth(payload.getWidth());
        if (payload.getHeight() != null) element.setHeight(payload.getHeight());
        if (payload.getZIndex() != null) element.setZIndex(payload.getZIndex());
        if (payload.getColor() != null || payload.getFillColor() != null) {
            element.setColorPrimary(colorOf(payload));
        }

        ElementMetadata incoming = toMetadata(payload);
        incoming.applyRollup(null);
        incoming.setType(payload.getType());
        ElementMetadata current = element.getMetadata() == null ? new ElementMetadata() : element.getMetadata();
        String token = current.getToken();
        current.mergeFrom(incoming);
        if (token != null) {
            // the token is the identity used by full saves; an update never re-keys an element
            current.setToken(token);
        }
        element.setMetadata(current);
    }

    ElementMetadata toMetadata(ElementPayload payload) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (payload.getMetadata() != null) {
            merged.putAll(payload.getMetadata());
        }
        if (payload.getProperties() != null) {
            merged.putAll(payload.getProperties());
        }
        if (payload.getFillColor() != null) {
            merged.put("fillColor", payload.getFillColor());
        }
        try {
            ElementMetadata metadata = objectMapper.convertValue(merged, ElementMetadata.class);
            return metadata == null ? new ElementMetadata() : metadata;
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Element metadata is malformed: " + e.getMessage());
        }
    }

    private static String colorOf(ElementPayload payload) {
        if (payload.getColor() != null && !payload.getColor().isBlank()) {
            return payload.getColor();
        }
        if (payload.getFillColor() != null && !payload.getFillColor().isBlank()) {
            return payload.getFillColor();
        }
        return MapElement.DEFAULT_COLOR;
    }
}
