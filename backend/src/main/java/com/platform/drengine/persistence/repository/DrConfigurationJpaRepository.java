package com.platform.drengine.persistence.repository;

import com.platform.drengine.persistence.entity.DrConfigurationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DrConfigurationJpaRepository extends JpaRepository<DrConfigurationEntity, String> {
}
