package com.hausbesuch.planner.service;

import com.hausbesuch.planner.dto.HomeLocationResponse;
import com.hausbesuch.planner.model.Setting;
import com.hausbesuch.planner.planning.GeoPoint;
import com.hausbesuch.planner.planning.RadiusSettings;
import com.hausbesuch.planner.repository.SettingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SettingsServiceTest {

    @Mock
    private SettingRepository settingRepository;

    @Mock
    private GeocodingService geocodingService;

    private final Map<String, Setting> store = new HashMap<>();

    private SettingsService settingsService;

    @BeforeEach
    void setUp() {
        settingsService = new SettingsService(settingRepository, geocodingService, 49.79245, 9.93296, 2.0, 8.0);
        when(settingRepository.findById(anyString()))
                .thenAnswer(invocation -> Optional.ofNullable(store.get(invocation.<String>getArgument(0))));
        when(settingRepository.existsById(anyString()))
                .thenAnswer(invocation -> store.containsKey(invocation.<String>getArgument(0)));
        when(settingRepository.save(any(Setting.class))).thenAnswer(invocation -> {
            Setting setting = invocation.getArgument(0);
            store.put(setting.getKey(), setting);
            return setting;
        });
    }

    @Test
    void defaultsAreSeededOnlyOnce() {
        store.put(Setting.RADIUS_WALK_KM, new Setting(Setting.RADIUS_WALK_KM, "1.5"));

        assertThat(settingsService.seedDefaults()).isEqualTo(3);
        assertThat(settingsService.seedDefaults()).isZero();
        assertThat(settingsService.radiusSettings()).isEqualTo(new RadiusSettings(1.5, 8.0));
    }

    @Test
    void unreadableValuesFallBackToDefaults() {
        store.put(Setting.HOME_LAT, new Setting(Setting.HOME_LAT, "abc"));
        store.put(Setting.RADIUS_BIKE_KM, new Setting(Setting.RADIUS_BIKE_KM, "-3"));

        assertThat(settingsService.homeLocation()).isEqualTo(new GeoPoint(49.79245, 9.93296));
        assertThat(settingsService.radiusSettings()).isEqualTo(new RadiusSettings(2.0, 8.0));
    }

    @Test
    void homeLocationIsGeocodedFromAddressAndCity() {
        when(geocodingService.resolve("Marktplatz 5, Würzburg")).thenReturn(Optional.of(new GeoPoint(49.7939, 9.9294)));

        HomeLocationResponse response = settingsService.updateHomeLocation("Marktplatz 5", "Würzburg");

        assertThat(response.geocoded()).isTrue();
        assertThat(settingsService.homeLocation()).isEqualTo(new GeoPoint(49.7939, 9.9294));
        assertThat(settingsService.homeAddress()).isEqualTo("Marktplatz 5");
        assertThat(settingsService.find(Setting.HOME_CITY)).contains("Würzburg");
    }

    @Test
    void failedGeocodeKeepsPreviousCoordinates() {
        store.put(Setting.HOME_LAT, new Setting(Setting.HOME_LAT, "50.0"));
        store.put(Setting.HOME_LON, new Setting(Setting.HOME_LON, "10.0"));
        when(geocodingService.resolve(anyString())).thenReturn(Optional.empty());

        HomeLocationResponse response = settingsService.updateHomeLocation("Irgendwo 1", "Nirgends");

        assertThat(response.geocoded()).isFalse();
        assertThat(settingsService.homeLocation()).isEqualTo(new GeoPoint(50.0, 10.0));
        assertThat(settingsService.homeAddress()).isEqualTo("Irgendwo 1");
    }
}
