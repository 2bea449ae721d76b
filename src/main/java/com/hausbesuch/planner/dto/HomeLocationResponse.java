package com.hausbesuch.planner.dto;

public record HomeLocationResponse(String address,
                                   String city,
                                   double latitude,
                                   double longitude,
                                   boolean geocoded) {
}
