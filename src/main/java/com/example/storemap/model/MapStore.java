package com.example.storemap.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@Document("stores")
public class MapStore {
    @Id
    private Long id;
    private String name;
    private String mapImageUrl;
    // cache of "some element is unpublished, or the map was never published"
    private boolean draftChanges;
    private Instant publishedAt;
    private Instant updatedAt;
    private long lockVersion;
}
