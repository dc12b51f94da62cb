package com.example.storemap.model;

import lombok.*;

import java.util.List;

/**
 * Denormalized aisle/shelf summary of the products linked to a pin.
 * {@code aisles} and {@code shelves} are parallel lists, one entry per distinct location.
 */
@Value
@Builder
public class LocationRollup {
    List<String> aisles;
    List<String> shelves;
    String primaryAisle;
    String primaryShelf;
    int locationCount;
}
