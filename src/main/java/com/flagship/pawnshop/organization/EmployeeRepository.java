package com.flagship.pawnshop.organization;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface EmployeeRepository extends JpaRepository<EmployeeEntity, UUID> {

    List<EmployeeEntity> findByBranchId(UUID branchId, Pageable pageable);

    boolean existsByUserId(UUID userId);

    long countByEmployeeTypeId(UUID employeeTypeId);

    long countByBranchId(UUID branchId);
}
