package com.example.storemap.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Metadata carried by a map element.
 *
 * <p>The known keys are typed fields: the client token that identifies the element
 * across a full-document save, the element type, an optional image URL handed over
 * by the upload flow, and the location rollup maintained for linked pins. Anything
 * else the editor sends (fill colour, stroke, label offsets, ...) is kept verbatim in
 * {@link #getExtensions()} and serialized beside the known keys.</p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ElementMetadata {
    private String token;
    private String type;
    private String imageUrl;

    private List<String> aisles;
    private List<String> shelves;
    private String primaryAisle;
    private String primaryShelf;
    private Integer locationCount;

    @Builder.Default
    private Map<String, Object> extensions = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getExtensions() {
        return extensions;
    }

    @JsonAnySetter
    public void putExtension(String key, Object value) {
        if (extensions == null) {
            extensions = new LinkedHashMap<>();
        }
        extensions.put(key, value);
    }

    /**
     * Overlays {@code incoming} onto this metadata. Keys present in {@code incoming}
     * win; keys it does not carry keep their current value.
     */
    public void mergeFrom(ElementMetadata incoming) {
        if (incoming == null) {
            return;
        }
        if (incoming.token != null) token = incoming.token;
        if (incoming.type != null) type = incoming.type;
        if (incoming.imageUrl != null) imageUrl = incoming.imageUrl;
        if (incoming.aisles != null) aisles = new ArrayList<>(incoming.aisles);
        if (incoming.shelves != null) shelves = new ArrayList<>(incoming.shelves);
        if (incoming.primaryAisle != null) primaryAisle = incoming.primaryAisle;
        if (incoming.primaryShelf != null) primaryShelf = incoming.primaryShelf;
        if (incoming.locationCount != null) locationCount = incoming.locationCount;
        if (incoming.extensions != null) {
            incoming.extensions.forEach(this::putExtension);
        }
    }

    /**
     * Stores {@code rollup} on the element, or clears every rollup key when it is null.
     */
    public void applyRollup(LocationRollup rollup) {
        if (rollup == null) {
            aisles = null;
            shelves = null;
            primaryAisle = null;
            primaryShelf = null;
            locationCount = null;
            return;
        }
        aisles = new ArrayList<>(rollup.getAisles());
        shelves = new ArrayList<>(rollup.getShelves());
        primaryAisle = rollup.getPrimaryAisle();
        primaryShelf = rollup.getPrimaryShelf();
        locationCount = rollup.getLocationCount();
    }

    @JsonIgnore
    public LocationRollup getRollup() {
        if (aisles == null || locationCount == null) {
            return null;
        }
        return LocationRollup.builder()
                .aisles(new ArrayList<>(aisles))
                .shelves(shelves == null ? List.of() : new ArrayList<>(shelves))
                .primaryAisle(primaryAisle)
                .primaryShelf(primaryShelf)
                .locationCount(locationCount)
                .build();
    }

    public ElementMetadata copy() {
        return ElementMetadata.builder()
                .token(token)
                .type(type)
                .imageUrl(imageUrl)
                .aisles(aisles == null ? null : new ArrayList<>(aisles))
                .shelves(shelves == null ? null : new ArrayList<>(shelves))
                .primaryAisle(primaryAisle)
                .primaryShelf(primaryShelf)
                .locationCount(locationCount)
                .extensions(extensions == null ? new LinkedHashMap<>() : new LinkedHashMap<>(extensions))
                .build();
    }
}
