package com.example.storemap.service;

import com.example.storemap.model.InventoryItem;
import com.example.storemap.model.LocationRollup;
import lombok.NonNull;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

/**
 * Summarises where the products linked to a pin can be found.
 */
@Component
public class LocationRollupCalculator {

    private static final Comparator<Location> ORDER = Comparator
            .comparing(Location::getAisle)
            .thenComparing(Location::getShelf, Comparator.nullsLast(Comparator.naturalOrder()));

    /**
     * Distinct (aisle, shelf) pairs of products with an aisle, sorted by aisle then shelf.
     *
     * @return the rollup, or null when no product has a location
     */
    public LocationRollup compute(Collection<InventoryItem> products) {
        TreeSet<Location> locations = new TreeSet<>(ORDER);
        for (InventoryItem product : products) {
            if (product.getAisle() != null) {
                locations.add(new Location(product.getAisle(), product.getShelf()));
            }
        }
        if (locations.isEmpty()) {
            return null;
        }

        List<String> aisles = new ArrayList<>(locations.size());
        List<String> shelves = new ArrayList<>(locations.size());
        for (Location location : locations) {
            aisles.add(location.getAisle());
            shelves.add(location.getShelf());
        }
        Location first = locations.first();
        return LocationRollup.builder()
                .aisles(aisles)
                .shelves(shelves)
                .primaryAisle(first.getAisle())
                .primaryShelf(first.getShelf())
                .locationCount(locations.size())
                .build();
    }

    @Value
    private static class Location {
        @NonNull
        String aisle;
        String shelf;
    }
}
