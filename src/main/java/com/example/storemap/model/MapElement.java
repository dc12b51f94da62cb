package com.example.storemap.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@Document("map_elements")
@CompoundIndexes({
        @CompoundIndex(name = "store_token", def = "{'storeId': 1, 'metadata.token': 1}"),
        @CompoundIndex(name = "store_published", def = "{'storeId': 1, 'published': 1}")
})
public class MapElement {
    public static final String DEFAULT_COLOR = "#3b82f6";

    @Id
    private Long id;
    private Long storeId;
    private String type;
    private String name;
    private Double x;
    private Double y;
    private Double width;
    private Double height;
    private Integer zIndex;
    private String colorPrimary;
    private ElementMetadata metadata;
    private boolean published;
    private Instant publishedAt;
    private Instant updatedAt;

    // Jackson would otherwise derive "zindex" from the accessor name
    @JsonProperty("zIndex")
    public Integer getZIndex() {
        return zIndex;
    }

    @JsonProperty("zIndex")
    public void setZIndex(Integer zIndex) {
        this.zIndex = zIndex;
    }

    public String token() {
        return metadata == null ? null : metadata.getToken();
    }

    /**
     * Deep copy, so callers holding the copy cannot reach the stored metadata.
     */
    public MapElement copy() {
        return toBuilder()
                .metadata(metadata == null ? null : metadata.copy())
                .build();
    }
}
