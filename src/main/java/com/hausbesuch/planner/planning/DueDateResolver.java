package com.hausbesuch.planner.planning;

import com.hausbesuch.planner.model.Patient;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Decides whether a patient's visit falls due on a given calendar day.
 * <p>
 * An explicit planned date equal to {@code today} always wins. One-time patients are due from
 * their planned date onwards and never without one. Recurring patients are due once
 * {@code lastVisit + intervalDays} has been reached. A snooze hides a patient that would
 * otherwise be due by rule.
 */
@Component
public class DueDateResolver {

    public boolean isDue(Patient patient, LocalDate today) {
        return resolve(patient, today) == DueStatus.DUE;
    }

    public DueStatus resolve(Patient patient, LocalDate today) {
        if (patient == null || today == null) {
            return DueStatus.INVALID_DATES;
        }
        if (patient.isPlannedVisitDateUnreadable()) {
            return DueStatus.INVALID_DATES;
        }
        LocalDate planned = patient.getPlannedVisitDate();
        if (planned != null && planned.isEqual(today)) {
            return DueStatus.DUE;
        }

        Integer interval = patient.getIntervalDays();
        if (interval == null || interval < 0) {
            return DueStatus.INVALID_DATES;
        }

        boolean dueByDate;
        if (interval == 0) {
            dueByDate = planned != null && !planned.isAfter(today);
        } else {
            if (patient.getLastVisit() == null) {
                return DueStatus.INVALID_DATES;
            }
            LocalDate nextDue = patient.getLastVisit().toLocalDate().plusDays(interval);
            dueByDate = !nextDue.isAfter(today);
        }

        if (!dueByDate) {
            return DueStatus.NOT_DUE;
        }
        LocalDate snoozeUntil = patient.getSnoozeUntil();
        if (snoozeUntil != null && snoozeUntil.isAfter(today)) {
            return DueStatus.SNOOZED;
        }
        return DueStatus.DUE;
    }

    /**
     * Next calendar day on which the patient becomes due by rule, or {@code null} when no such
     * day can be computed (one-time patient without planned date, malformed data).
     */
    public LocalDate nextDueDate(Patient patient) {
        if (patient == null || patient.getIntervalDays() == null || patient.getIntervalDays() < 0) {
            return null;
        }
        if (patient.getIntervalDays() == 0) {
            return patient.getPlannedVisitDate();
        }
        if (patient.getLastVisit() == null) {
            return null;
        }
        return patient.getLastVisit().toLocalDate().plusDays(patient.getIntervalDays());
    }
}
