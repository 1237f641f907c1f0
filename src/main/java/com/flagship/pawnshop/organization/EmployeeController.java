package com.flagship.pawnshop.organization;

import com.flagship.pawnshop.access.AccessGuard;
import com.flagship.pawnshop.access.Permission;
import com.flagship.pawnshop.common.PageLimits;
import com.flagship.pawnshop.organization.dto.EmployeeRequest;
import com.flagship.pawnshop.organization.dto.EmployeeResponse;
import com.flagship.pawnshop.organization.dto.EmployeeTypeRequest;
import com.flagship.pawnshop.organization.dto.EmployeeTypeResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Employees and employee types. Both are user administration and share its permissions.
 */
@RestController
@RequestMapping("/api/v1/employees")
@RequiredArgsConstructor
public class EmployeeController {

    private final EmployeeService employeeService;
    private final PageLimits pageLimits;

    @GetMapping
    public ResponseEntity<List<EmployeeResponse>> list(
            @RequestParam(value = "branch_id", required = false) UUID branchId,
            @RequestParam(value = "skip", required = false) Integer skip,
            @RequestParam(value = "limit", required = false) Integer limit) {
        AccessGuard.require(Permission.VIEW_USERS);
        return ResponseEntity.ok(employeeService.list(branchId, pageLimits.of(skip, limit)).stream()
            .map(EmployeeResponse::from)
            .toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<EmployeeResponse> get(@PathVariable("id") UUID id) {
        AccessGuard.require(Permission.VIEW_USERS);
        return ResponseEntity.ok(EmployeeResponse.from(employeeService.get(id)));
    }

    @PostMapping
    public ResponseEntity<EmployeeResponse> create(@Valid @RequestBody EmployeeRequest request) {
        AccessGuard.require(Permission.MANAGE_USERS);
        return ResponseEntity.status(HttpStatus.CREATED).body(EmployeeResponse.from(employeeService.create(request)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<EmployeeResponse> update(@PathVariable("id") UUID id,
                                                   @Valid @RequestBody EmployeeRequest request) {
        AccessGuard.require(Permission.MANAGE_USERS);
        return ResponseEntity.ok(EmployeeResponse.from(employeeService.update(id, request)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") UUID id) {
        AccessGuard.require(Permission.MANAGE_USERS);
        employeeService.delete(id);
        return ResponseEntity.noContent().build();
    }

    // ==================== Employee types ====================

    @GetMapping("/types")
    public ResponseEntity<List<EmployeeTypeResponse>> listTypes() {
        AccessGuard.require(Permission.VIEW_USERS);
        return ResponseEntity.ok(employeeService.listTypes().stream().map(EmployeeTypeResponse::from).toList());
    }

    @GetMapping("/types/{id}")
    public ResponseEntity<EmployeeTypeResponse> getType(@PathVariable("id") UUID id) {
        AccessGuard.require(Permission.VIEW_USERS);
        return ResponseEntity.ok(EmployeeTypeResponse.from(employeeService.getType(id)));
    }

    @PostMapping("/types")
    public ResponseEntity<EmployeeTypeResponse> createType(@Valid @RequestBody EmployeeTypeRequest request) {
        AccessGuard.require(Permission.MANAGE_USERS);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(EmployeeTypeResponse.from(employeeService.createType(request)));
    }

    @PutMapping("/types/{id}")
    public ResponseEntity<EmployeeTypeResponse> updateType(@PathVariable("id") UUID id,
                                                           @Valid @RequestBody EmployeeTypeRequest request) {
        AccessGuard.require(Permission.MANAGE_USERS);
        return ResponseEntity.ok(EmployeeTypeResponse.from(employeeService.updateType(id, request)));
    }

    @DeleteMapping("/types/{id}")
    public ResponseEntity<Void> deleteType(@PathVariable("id") UUID id) {
        AccessGuard.require(Permission.MANAGE_USERS);
        employeeService.deleteType(id);
        return ResponseEntity.noContent().build();
    }
}
