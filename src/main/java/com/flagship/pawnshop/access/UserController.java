package com.flagship.pawnshop.access;

import com.flagship.pawnshop.access.dto.CreateUserRequest;
import com.flagship.pawnshop.access.dto.RoleRequest;
import com.flagship.pawnshop.access.dto.RoleResponse;
import com.flagship.pawnshop.access.dto.UpdateUserRequest;
import com.flagship.pawnshop.access.dto.UserResponse;
import com.flagship.pawnshop.common.PageLimits;
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
 * User and role administration endpoints.
 */
@RestController
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;
    private final PageLimits pageLimits;

    @GetMapping
    public ResponseEntity<List<UserResponse>> listUsers(
            @RequestParam(value = "skip", required = false) Integer skip,
            @RequestParam(value = "limit", required = false) Integer limit) {
        AccessGuard.require(Permission.VIEW_USERS);
        List<UserResponse> users = userService.listUsers(pageLimits.of(skip, limit)).stream()
            .map(this::toResponse)
            .toList();
        return ResponseEntity.ok(users);
    }

    @PostMapping
    public ResponseEntity<UserResponse> createUser(@Valid @RequestBody CreateUserRequest request) {
        AccessGuard.require(Permission.MANAGE_USERS);
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(userService.createUser(request)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<UserResponse> getUser(@PathVariable("id") UUID id) {
        AccessGuard.require(Permission.VIEW_USERS);
        return ResponseEntity.ok(toResponse(userService.getUser(id)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<UserResponse> updateUser(@PathVariable("id") UUID id,
                                                   @Valid @RequestBody UpdateUserRequest request) {
        AccessGuard.require(Permission.MANAGE_USERS);
        return ResponseEntity.ok(toResponse(userService.updateUser(id, request)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteUser(@PathVariable("id") UUID id) {
        AccessGuard.require(Permission.MANAGE_USERS);
        userService.deleteUser(id);
        return ResponseEntity.noContent().build();
    }

    // ==================== Roles ====================

    @GetMapping("/roles")
    public ResponseEntity<List<RoleResponse>> listRoles() {
        AccessGuard.require(Permission.VIEW_USERS);
        return ResponseEntity.ok(userService.listRoles().stream().map(RoleResponse::from).toList());
    }

    @PostMapping("/roles")
    public ResponseEntity<RoleResponse> createRole(@Valid @RequestBody RoleRequest request) {
        AccessGuard.require(Permission.MANAGE_USERS);
        return ResponseEntity.status(HttpStatus.CREATED).body(RoleResponse.from(userService.createRole(request)));
    }

    @GetMapping("/roles/{id}")
    public ResponseEntity<RoleResponse> getRole(@PathVariable("id") UUID id) {
        AccessGuard.require(Permission.VIEW_USERS);
        return ResponseEntity.ok(RoleResponse.from(userService.getRole(id)));
    }

    @PutMapping("/roles/{id}")
    public ResponseEntity<RoleResponse> updateRole(@PathVariable("id") UUID id,
                                                   @Valid @RequestBody RoleRequest request) {
        AccessGuard.require(Permission.MANAGE_USERS);
        return ResponseEntity.ok(RoleResponse.from(userService.updateRole(id, request)));
    }

    @DeleteMapping("/roles/{id}")
    public ResponseEntity<Void> deleteRole(@PathVariable("id") UUID id) {
        AccessGuard.require(Permission.MANAGE_USERS);
        userService.deleteRole(id);
        return ResponseEntity.noContent().build();
    }

    private UserResponse toResponse(UserEntity user) {
        String roleName = userService.roleName(user.getRoleId());
        return UserResponse.from(user, roleName, AccessControlTable.permissionsFor(roleName));
    }
}
