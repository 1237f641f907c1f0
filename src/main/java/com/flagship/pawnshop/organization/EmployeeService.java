package com.flagship.pawnshop.organization;

import com.flagship.pawnshop.access.UserRepository;
import com.flagship.pawnshop.exception.BusinessValidationException;
import com.flagship.pawnshop.exception.ConflictException;
import com.flagship.pawnshop.exception.NotFoundException;
import com.flagship.pawnshop.organization.dto.EmployeeRequest;
import com.flagship.pawnshop.organization.dto.EmployeeTypeRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Employees and employee types.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmployeeService {

    private final EmployeeRepository employeeRepository;
    private final EmployeeTypeRepository employeeTypeRepository;
    private final BranchRepository branchRepository;
    private final UserRepository userRepository;

    // ==================== Employees ====================

    @Transactional(readOnly = true)
    public List<EmployeeEntity> list(UUID branchId, Pageable pageable) {
        if (branchId != null) {
            return employeeRepository.findByBranchId(branchId, pageable);
        }
        return employeeRepository.findAll(pageable).getContent();
    }

    @Transactional(readOnly = true)
    public EmployeeEntity get(UUID id) {
        return employeeRepository.findById(id)
            .orElseThrow(() -> new NotFoundException("Employee", id));
    }

    @Transactional
    public EmployeeEntity create(EmployeeRequest request) {
        if (request.getUserId() == null || request.getBranchId() == null || request.getEmployeeTypeId() == null) {
            throw new IllegalArgumentException("user_id, branch_id and employee_type_id are required");
        }
        if (!userRepository.existsById(request.getUserId())) {
            throw new NotFoundException("User", request.getUserId());
        }
        requireBranch(request.getBranchId());
        requireType(request.getEmployeeTypeId());
        if (employeeRepository.existsByUserId(request.getUserId())) {
            throw new BusinessValidationException("unique_employee_user",
                "Employee record already exists for this user");
        }

        EmployeeEntity saved = employeeRepository.save(EmployeeEntity.create(
            request.getUserId(), request.getBranchId(), request.getEmployeeTypeId(), request.getHireDate()));
        log.info("Employee created: employeeId={}, userId={}, branchId={}",
            saved.getId(), saved.getUserId(), saved.getBranchId());
        return saved;
    }

    @Transactional
    public EmployeeEntity update(UUID id, EmployeeRequest request) {
        EmployeeEntity employee = get(id);
        if (request.getBranchId() != null) {
            requireBranch(request.getBranchId());
        }
        if (request.getEmployeeTypeId() != null) {
            requireType(request.getEmployeeTypeId());
        }
        employee.update(request.getBranchId(), request.getEmployeeTypeId(), request.getHireDate());
        return employeeRepository.save(employee);
    }

    @Transactional
    public void delete(UUID id) {
        employeeRepository.delete(get(id));
        log.info("Employee deleted: employeeId={}", id);
    }

    // ==================== Employee types ====================

    @Transactional(readOnly = true)
    public List<EmployeeTypeEntity> listTypes() {
        return employeeTypeRepository.findAll(Sort.by("name"));
    }

    @Transactional(readOnly = true)
    public EmployeeTypeEntity getType(UUID id) {
        return requireType(id);
    }

    @Transactional
    public EmployeeTypeEntity createType(EmployeeTypeRequest request) {
        if (employeeTypeRepository.existsByNameIgnoreCase(request.getName())) {
            throw new BusinessValidationException("unique_employee_type",
                "Employee type with this name already exists");
        }
        return employeeTypeRepository.save(EmployeeTypeEntity.create(request.getName(), request.getDescription()));
    }

    @Transactional
    public EmployeeTypeEntity updateType(UUID id, EmployeeTypeRequest request) {
        EmployeeTypeEntity type = requireType(id);
        if (!type.getName().equalsIgnoreCase(request.getName())
                && employeeTypeRepository.existsByNameIgnoreCase(request.getName())) {
            throw new BusinessValidationException("unique_employee_type",
                "Employee type with this name already exists");
        }
        type.update(request.getName(), request.getDescription());
        return employeeTypeRepository.save(type);
    }

    /**
     * @throws ConflictException if any employee references the type
     */
    @Transactional
    public void deleteType(UUID id) {
        EmployeeTypeEntity type = requireType(id);
        long employees = employeeRepository.countByEmployeeTypeId(id);
        if (employees > 0) {
            throw new ConflictException(String.format(
                "Cannot delete employee type that is assigned to %d employees", employees));
        }
        employeeTypeRepository.delete(type);
        log.info("Employee type deleted: typeId={}, name={}", id, type.getName());
    }

    private void requireBranch(UUID branchId) {
        if (!branchRepository.existsById(branchId)) {
            throw new NotFoundException("Branch", branchId);
        }
    }

    private EmployeeTypeEntity requireType(UUID typeId) {
        return employeeTypeRepository.findById(typeId)
            .orElseThrow(() -> new NotFoundException("Employee type", typeId));
    }
}
