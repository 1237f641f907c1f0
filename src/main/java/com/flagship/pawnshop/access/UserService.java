package com.flagship.pawnshop.access;

import com.flagship.pawnshop.access.dto.CreateUserRequest;
import com.flagship.pawnshop.access.dto.RoleRequest;
import com.flagship.pawnshop.access.dto.UpdateUserRequest;
import com.flagship.pawnshop.exception.BusinessValidationException;
import com.flagship.pawnshop.exception.ConflictException;
import com.flagship.pawnshop.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * User and role administration.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private final UserRepository userRepository;
    private final RoleRepository roleRepository;
    private final PasswordEncoder passwordEncoder;

    // ==================== Users ====================

    @Transactional(readOnly = true)
    public List<UserEntity> listUsers(Pageable pageable) {
        return userRepository.findAll(pageable).getContent();
    }

    @Transactional(readOnly = true)
    public UserEntity getUser(UUID id) {
        return userRepository.findById(id)
            .orElseThrow(() -> new NotFoundException("User", id));
    }

    @Transactional
    public UserEntity createUser(CreateUserRequest request) {
        if (userRepository.existsByUsername(request.getUsername())) {
            throw new BusinessValidationException("unique_username", "Username already registered");
        }
        if (userRepository.existsByEmail(request.getEmail())) {
            throw new BusinessValidationException("unique_email", "Email already registered");
        }
        requireRole(request.getRoleId());

        UserEntity user = UserEntity.create(
            request.getUsername(),
            request.getEmail(),
            passwordEncoder.encode(request.getPassword()),
            request.getFirstName(),
            request.getLastName(),
            request.isSuperuser(),
            request.getRoleId());

        UserEntity saved = userRepository.save(user);
        log.info("User created: userId={}, username={}", saved.getId(), saved.getUsername());
        return saved;
    }

    @Transactional
    public UserEntity updateUser(UUID id, UpdateUserRequest request) {
        UserEntity user = getUser(id);

        if (request.getEmail() != null
                && !request.getEmail().equalsIgnoreCase(user.getEmail())
                && userRepository.existsByEmail(request.getEmail())) {
            throw new BusinessValidationException("unique_email", "Email already registered");
        }
        if (request.getRoleId() != null) {
            requireRole(request.getRoleId());
            user.assignRole(request.getRoleId());
        }
        if (request.getPassword() != null) {
            user.changePassword(passwordEncoder.encode(request.getPassword()));
        }
        user.updateProfile(request.getEmail(), request.getFirstName(), request.getLastName(), request.getActive());

        log.info("User updated: userId={}", id);
        return userRepository.save(user);
    }

    @Transactional
    public void deleteUser(UUID id) {
        UserEntity user = getUser(id);
        userRepository.delete(user);
        log.info("User deleted: userId={}, username={}", id, user.getUsername());
    }

    // ==================== Roles ====================

    @Transactional(readOnly = true)
    public List<RoleEntity> listRoles() {
        return roleRepository.findAll(Sort.by("name"));
    }

    @Transactional(readOnly = true)
    public RoleEntity getRole(UUID id) {
        return requireRole(id);
    }

    @Transactional(readOnly = true)
    public String roleName(UUID roleId) {
        return roleRepository.findById(roleId).map(RoleEntity::getName).orElse(null);
    }

    @Transactional
    public RoleEntity createRole(RoleRequest request) {
        if (roleRepository.existsByNameIgnoreCase(request.getName())) {
            throw new BusinessValidationException("unique_role_name", "Role already exists: " + request.getName());
        }
        RoleEntity saved = roleRepository.save(RoleEntity.create(request.getName(), request.getDescription()));
        if (BuiltInRole.fromName(saved.getName()).isEmpty()) {
            log.warn("Role {} has no permission set; its users will be refused everywhere", saved.getName());
        }
        return saved;
    }

    @Transactional
    public RoleEntity updateRole(UUID id, RoleRequest request) {
        RoleEntity role = requireRole(id);
        if (!role.getName().equalsIgnoreCase(request.getName())
                && roleRepository.existsByNameIgnoreCase(request.getName())) {
            throw new BusinessValidationException("unique_role_name", "Role already exists: " + request.getName());
        }
        role.update(request.getName(), request.getDescription());
        return roleRepository.save(role);
    }

    /**
     * Deletes a role nobody holds.
     *
     * @throws ConflictException if any user still references the role
     */
    @Transactional
    public void deleteRole(UUID id) {
        RoleEntity role = requireRole(id);
        long holders = userRepository.countByRoleId(id);
        if (holders > 0) {
            throw new ConflictException(String.format(
                "Cannot delete role '%s': assigned to %d users", role.getName(), holders));
        }
        roleRepository.delete(role);
        log.info("Role deleted: roleId={}, name={}", id, role.getName());
    }

    private RoleEntity requireRole(UUID roleId) {
        return roleRepository.findById(roleId)
            .orElseThrow(() -> new NotFoundException("Role", roleId));
    }
}
