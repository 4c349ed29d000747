package com.warehouse.requisitions.repository;

import com.warehouse.requisitions.model.Area;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.Optional;

public interface AreaRepository extends JpaRepository<Area, Long> {
    Optional<Area> findByCode(String code);
}
