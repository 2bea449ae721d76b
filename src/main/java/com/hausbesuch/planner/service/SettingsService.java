package com.hausbesuch.planner.service;

import com.hausbesuch.planner.dto.HomeLocationResponse;
import com.hausbesuch.planner.model.Setting;
import com.hausbesuch.planner.planning.GeoPoint;
import com.hausbesuch.planner.planning.RadiusSettings;
import com.hausbesuch.planner.repository.SettingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.Optional;

@Service
public class SettingsService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SettingsService.class);

    private final SettingRepository settingRepository;
    private final GeocodingService geocodingService;
    private final double defaultHomeLat;
    private final double defaultHomeLon;
    private final double defaultRadiusWalkKm;
    private final double defaultRadiusBikeKm;

    public SettingsService(SettingRepository settingRepository,
                           GeocodingService geocodingService,
                           @Value("${planner.home.default-lat:49.79245}") double defaultHomeLat,
                           @Value("${planner.home.default-lon:9.93296}") double defaultHomeLon,
                           @Value("${planner.radius.default-walk-km:2.0}") double defaultRadiusWalkKm,
                           @Value("${planner.radius.default-bike-km:8.0}") double defaultRadiusBikeKm) {
        this.settingRepository = settingRepository;
        this.geocodingService = geocodingService;
        this.defaultHomeLat = defaultHomeLat;
        this.defaultHomeLon = defaultHomeLon;
        this.defaultRadiusWalkKm = defaultRadiusWalkKm;
        this.defaultRadiusBikeKm = defaultRadiusBikeKm;
    }

    @Transactional(readOnly = true)
    public Optional<String> find(String key) {
        return settingRepository.findById(key).map(Setting::getValue);
    }

    @Transactional
    public Setting put(String key, String value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Setting key is required.");
        }
        Setting setting = settingRepository.findById(key).orElse(new Setting(key, null));
        setting.setValue(value);
        return settingRepository.save(setting);
    }

    /**
     * Writes the built-in defaults for every well-known key that has no value yet.
     *
     * @return number of keys written
     */
    @Transactional
    public int seedDefaults() {
        Map<String, String> defaults = Map.of(
                Setting.HOME_LAT, String.valueOf(defaultHomeLat),
                Setting.HOME_LON, String.valueOf(defaultHomeLon),
                Setting.RADIUS_WALK_KM, String.valueOf(defaultRadiusWalkKm),
                Setting.RADIUS_BIKE_KM, String.valueOf(defaultRadiusBikeKm)
        );
        int written = 0;
        for (Map.Entry<String, String> entry : defaults.entrySet()) {
            if (!settingRepository.existsById(entry.getKey())) {
                settingRepository.save(new Setting(entry.getKey(), entry.getValue()));
                written++;
            }
        }
        return written;
    }

    @Transactional(readOnly = true)
    public GeoPoint homeLocation() {
        double lat = readDouble(Setting.HOME_LAT, defaultHomeLat);
        double lon = readDouble(Setting.HOME_LON, defaultHomeLon);
        GeoPoint home = new GeoPoint(lat, lon);
        if (!home.isValid()) {
            LOGGER.warn("Stored home location {}/{} is out of range, using default", lat, lon);
            return new GeoPoint(defaultHomeLat, defaultHomeLon);
        }
        return home;
    }

    @Transactional(readOnly = true)
    public String homeAddress() {
        return find(Setting.HOME_ADDRESS).orElse(null);
    }

    @Transactional(readOnly = true)
    public RadiusSettings radiusSettings() {
        double walk = readDouble(Setting.RADIUS_WALK_KM, defaultRadiusWalkKm);
        double bike = readDouble(Setting.RADIUS_BIKE_KM, defaultRadiusBikeKm);
        if (walk < 0 || bike < 0) {
            LOGGER.warn("Negative radius setting (walk={}, bike={}), using defaults", walk, bike);
            return new RadiusSettings(defaultRadiusWalkKm, defaultRadiusBikeKm);
        }
        return new RadiusSettings(walk, bike);
    }

    /**
     * Stores a new home address and geocodes it. When geocoding fails the previous coordinates
     * stay in place and the response says so.
     */
    @Transactional
    public HomeLocationResponse updateHomeLocation(String address, String city) {
        if (address == null || address.isBlank() || city == null || city.isBlank()) {
            throw new IllegalArgumentException("Address and city are required.");
        }
        Optional<GeoPoint> resolved = geocodingService.resolve(address.trim() + ", " + city.trim());
        GeoPoint location = resolved.orElseGet(this::homeLocation);
        if (resolved.isEmpty()) {
            LOGGER.warn("Home address '{}, {}' could not be geocoded, keeping {}", address, city, location);
        }

        put(Setting.HOME_ADDRESS, address.trim());
        put(Setting.HOME_CITY, city.trim());
        put(Setting.HOME_LAT, String.valueOf(location.latitude()));
        put(Setting.HOME_LON, String.valueOf(location.longitude()));
        return new HomeLocationResponse(address.trim(), city.trim(),
                location.latitude(), location.longitude(), resolved.isPresent());
    }

    private double readDouble(String key, double fallback) {
        Optional<String> raw = find(key);
        if (raw.isEmpty() || raw.get().isBlank()) {
            return fallback;
        }
        try {
            return Double.parseDouble(raw.get().trim());
        } catch (NumberFormatException e) {
            LOGGER.warn("Setting {} has non-numeric value '{}', using {}", key, raw.get(), fallback);
            return fallback;
        }
    }
}
