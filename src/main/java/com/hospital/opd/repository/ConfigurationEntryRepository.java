package com.hospital.opd.repository;

import com.hospital.opd.entity.ConfigurationEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ConfigurationEntryRepository extends JpaRepository<ConfigurationEntry, Long> {

    Optional<ConfigurationEntry> findByConfigKey(String configKey);

    List<ConfigurationEntry> findByActiveTrue();

    List<ConfigurationEntry> findByCategoryAndActiveTrueOrderByConfigKeyAsc(String category);
}
