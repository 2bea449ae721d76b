package com.hausbesuch.planner.scheduler;

import com.hausbesuch.planner.repository.PatientRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;

@Component
public class VisitMaintenanceScheduler {

    private static final Logger logger = LoggerFactory.getLogger(VisitMaintenanceScheduler.class);

    private final PatientRepository patientRepository;

    public VisitMaintenanceScheduler(PatientRepository patientRepository) {
        this.patientRepository = patientRepository;
    }

    /**
     * Clears snoozes that no longer hide anybody. Runs shortly after midnight.
     * cron: second minute hour day month weekday
     */
    @Scheduled(cron = "${planner.maintenance.cron:0 5 0 * * ?}")
    @Transactional
    public void clearExpiredSnoozes() {
        LocalDate today = LocalDate.now();
        try {
            int cleared = patientRepository.clearSnoozesUpTo(today);
            if (cleared > 0) {
                logger.info("[VisitMaintenanceScheduler] Cleared {} expired snooze(s) up to {}", cleared, today);
            } else {
                logger.debug("[VisitMaintenanceScheduler] No expired snoozes on {}", today);
            }
        } catch (RuntimeException e) {
            logger.error("[VisitMaintenanceScheduler] Clearing snoozes failed: {}", e.getMessage(), e);
        }
    }
}
