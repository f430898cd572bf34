package com.flagship.tip_ledger.shift;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface EmployeeRepository extends JpaRepository<EmployeeEntity, UUID> {

    List<EmployeeEntity> findByLocationIdAndRoleAndActiveTrue(UUID locationId, String role);

    List<EmployeeEntity> findByLocationIdOrderByDisplayNameAsc(UUID locationId);
}
