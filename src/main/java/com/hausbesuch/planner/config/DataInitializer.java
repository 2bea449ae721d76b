package com.hausbesuch.planner.config;

import com.hausbesuch.planner.service.SettingsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

@Component
public class DataInitializer implements CommandLineRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(DataInitializer.class);

    private final SettingsService settingsService;

    public DataInitializer(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @Override
    public void run(String... args) {
        int written = settingsService.seedDefaults();
        if (written > 0) {
            LOGGER.info("[DataInitializer] Seeded {} default setting(s)", written);
        }
        LOGGER.info("[DataInitializer] Home location {}, radius {}",
                settingsService.homeLocation(), settingsService.radiusSettings());
    }
}
