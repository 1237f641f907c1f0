package com.flagship.pawnshop.organization;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface EmployeeTypeRepository extends JpaRepository<EmployeeTypeEntity, UUID> {

    boolean existsByNameIgnoreCase(String name);
}
