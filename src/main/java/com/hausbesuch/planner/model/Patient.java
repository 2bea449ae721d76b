package com.hausbesuch.planner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.hausbesuch.planner.planning.GeoPoint;
import com.hausbesuch.planner.util.LocalDateConverter;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

@Entity
@Table(
        name = "patients",
        indexes = {
                @Index(name = "idx_patient_primary_provider", columnList = "primary_provider_id"),
                @Index(name = "idx_patient_override_provider", columnList = "override_provider_id")
        }
)
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Patient {

    @Id
    @GeneratedValue(strategy = GenerationType.AUTO)
    private Long id;

    @Column(name = "first_name", nullable = false)
    private String firstName;

    @Column(name = "last_name", nullable = false)
    private String lastName;

    @Column(nullable = false, length = 1024)
    private String address;

    @Column(nullable = true)
    private Double latitude;

    @Column(nullable = true)
    private Double longitude;

    @Column(name = "visit_duration_minutes", nullable = false)
    private Integer visitDurationMinutes = 30;

    // 0 = one-time visit
    @Column(name = "interval_days", nullable = false)
    private Integer intervalDays = 0;

    @Column(name = "last_visit")
    private LocalDateTime lastVisit;

    // raw column text; plannedVisitDate is derived from it
    @Column(name = "planned_visit_date")
    @JsonIgnore
    @Setter(AccessLevel.NONE)
    private String plannedVisitDateText;

    @Transient
    @Setter(AccessLevel.NONE)
    private LocalDate plannedVisitDate;

    @Transient
    @JsonIgnore
    @Setter(AccessLevel.NONE)
    private boolean plannedVisitDateUnreadable;

    @Column(name = "snooze_until")
    private LocalDate snoozeUntil;

    @Column(name = "primary_provider_id")
    private Long primaryProviderId;

    @Column(name = "override_provider_id")
    private Long overrideProviderId;

    @Column(name = "override_permanent", nullable = false)
    private Boolean overridePermanent = Boolean.FALSE;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    public void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        createdAt = now;
        updatedAt = now;
        if (lastVisit == null) {
            lastVisit = now;
        }
    }

    @PreUpdate
    public void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    @PostLoad
    public void onLoad() {
        setPlannedVisitDateText(plannedVisitDateText);
    }

    public void setPlannedVisitDate(LocalDate date) {
        plannedVisitDate = date;
        plannedVisitDateText = date != null ? date.toString() : null;
        plannedVisitDateUnreadable = false;
    }

    /**
     * Applies the stored text of the planned date. Text that is not a calendar date leaves the
     * date empty and marks it unreadable.
     */
    public void setPlannedVisitDateText(String text) {
        plannedVisitDateText = text;
        try {
            plannedVisitDate = LocalDateConverter.parse(text);
            plannedVisitDateUnreadable = false;
        } catch (DateTimeParseException e) {
            plannedVisitDate = null;
            plannedVisitDateUnreadable = true;
        }
    }

    public boolean isOneTime() {
        return intervalDays != null && intervalDays == 0;
    }

    /**
     * Coordinates of the patient's address, or {@code null} when geocoding has not succeeded.
     */
    public GeoPoint coordinates() {
        return GeoPoint.ofNullable(latitude, longitude);
    }
}
