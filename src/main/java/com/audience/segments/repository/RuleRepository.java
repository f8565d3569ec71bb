package com.audience.segments.repository;

import com.audience.segments.enums.RuleStatus;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RuleRepository extends JpaRepository<RuleEntity, Long> {

  List<RuleEntity> findByStatusOrderByIdAsc(RuleStatus status);

  Page<RuleEntity> findByStatus(RuleStatus status, Pageable pageable);

  List<RuleEntity> findAllByOrderByIdAsc();

  Optional<RuleEntity> findByName(String name);

  boolean existsByName(String name);
}
