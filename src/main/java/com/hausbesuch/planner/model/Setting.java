package com.hausbesuch.planner.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "settings")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Setting {

    public static final String HOME_ADDRESS = "home_address";
    public static final String HOME_CITY = "home_city";
    public static final String HOME_LAT = "home_lat";
    public static final String HOME_LON = "home_lon";
    public static final String RADIUS_WALK_KM = "radius_walk_km";
    public static final String RADIUS_BIKE_KM = "radius_bike_km";

    @Id
    @Column(name = "setting_key", nullable = false, length = 128)
    private String key;

    @Column(name = "setting_value", length = 1024)
    private String value;
}
