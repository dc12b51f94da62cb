package com.example.storemap.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One element as sent by the map editor.
 *
 * <p>{@code id} is whatever the editor currently holds: the client token of an element
 * that was never saved, or the persisted id (as text) after a reload. Properties without
 * a dedicated field (stroke, label offsets, font, ...) land in {@link #getProperties()}
 * and end up in the element metadata.</p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ElementPayload {
    private String id;
    private String token;
    private String type;
    private String name;
    private Double x;
    private Double y;
    private Double width;
    private Double height;
    private Integer zIndex;
    private String color;
    private String fillColor;
    private Map<String, Object> metadata;

    @Builder.Default
    private Map<String, Object> properties = new LinkedHashMap<>();

    @JsonProperty("zIndex")
    public Integer getZIndex() {
        return zIndex;
    }

    @JsonProperty("zIndex")
    public void setZIndex(Integer zIndex) {
        this.zIndex = zIndex;
    }

    @JsonAnyGetter
    public Map<String, Object> getProperties() {
        return properties;
    }

    @JsonAnySetter
    public void putProperty(String key, Object value) {
        if (properties == null) {
            properties = new LinkedHashMap<>();
        }
        properties.put(key, value);
    }
}
