package com.hausbesuch.planner.repository;

import com.hausbesuch.planner.model.Provider;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProviderRepository extends JpaRepository<Provider, Long> {

    List<Provider> findAllByOrderByIdAsc();
}
