package com.flagship.pawnshop.access;

import com.flagship.pawnshop.config.PawnshopProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates the first admin account on an empty user table.
 *
 * Roles are seeded by the schema migration; this only adds the user, and only
 * when a bootstrap password is configured.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BootstrapAdminInitializer implements ApplicationRunner {

    private final PawnshopProperties properties;
    private final UserRepository userRepository;
    private final RoleRepository roleRepository;
    private final PasswordEncoder passwordEncoder;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        PawnshopProperties.Bootstrap bootstrap = properties.getBootstrap();
        if (!bootstrap.isEnabled() || userRepository.count() > 0) {
            return;
        }
        if (bootstrap.getAdminPassword() == null || bootstrap.getAdminPassword().isBlank()) {
            log.warn("No users exist and pawnshop.bootstrap.admin-password is not set; skipping admin bootstrap");
            return;
        }

        RoleEntity adminRole = roleRepository.findByNameIgnoreCase(BuiltInRole.ADMIN.roleName())
            .orElseGet(() -> roleRepository.save(RoleEntity.create(BuiltInRole.ADMIN.roleName(), "Administrator")));

        UserEntity admin = UserEntity.create(
            bootstrap.getAdminUsername(),
            bootstrap.getAdminEmail(),
            passwordEncoder.encode(bootstrap.getAdminPassword()),
            "System",
            "Administrator",
            true,
            adminRole.getId());
        userRepository.save(admin);

        log.info("Bootstrap admin created: username={}", admin.getUsername());
    }
}
