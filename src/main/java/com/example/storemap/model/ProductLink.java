package com.example.storemap.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("product_map_links")
@CompoundIndex(name = "store_product_element", def = "{'storeId': 1, 'productId': 1, 'elementId': 1}", unique = true)
public class ProductLink {
    @Id
    private Long id;
    private Long storeId;
    private Long productId;
    private Long elementId;
    private Instant createdAt;
}
