package com.hausbesuch.planner.repository;

import com.hausbesuch.planner.model.Patient;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface PatientRepository extends JpaRepository<Patient, Long> {

    List<Patient> findAllByOrderByIdAsc();

    List<Patient> findByPrimaryProviderIdOrOverrideProviderId(Long primaryProviderId, Long overrideProviderId);

    @Modifying
    @Query("UPDATE Patient p SET p.snoozeUntil = null WHERE p.snoozeUntil <= :date")
    int clearSnoozesUpTo(@Param("date") LocalDate date);
}
