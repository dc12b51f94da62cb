package com.example.storemap.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * A product as stocked by one store. Owned by the product catalogue; read-only here.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("store_inventory")
public class InventoryItem {
    @Id
    private String id;
    private Long storeId;
    private Long productId;
    private String productName;
    private String sku;
    private String aisle;
    private String shelf;
}
