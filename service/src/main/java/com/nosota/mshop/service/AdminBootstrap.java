package com.nosota.mshop.service;

import com.nosota.mshop.api.model.UserRole;
import com.nosota.mshop.config.ShopProperties;
import com.nosota.mshop.model.User;
import com.nosota.mshop.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Creates the admin account on startup when none exists yet.
 *
 * <p>Runs once every singleton is ready, after Flyway has migrated the schema and before the
 * web server is started, so no request is served while the admin is still missing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AdminBootstrap implements SmartInitializingSingleton {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final ShopProperties properties;

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void afterSingletonsInstantiated() {
        ensureAdmin();
    }

    /**
     * Idempotent: does nothing if any ADMIN account exists.
     *
     * @return true if an admin was created
     */
    @Transactional(rollbackFor = Exception.class)
    public boolean ensureAdmin() {
        if (userRepository.existsByRole(UserRole.ADMIN)) {
            log.info("Admin account already exists");
            return false;
        }

        ShopProperties.Admin admin = properties.admin();
        if (!StringUtils.hasText(admin.username()) || !StringUtils.hasText(admin.password())) {
            log.warn("No admin account exists and ADMIN_USERNAME/ADMIN_PASSWORD are not set; skipping admin creation");
            return false;
        }

        User user = new User();
        user.setName(admin.name());
        user.setUsername(admin.username());
        user.setEmail(admin.email());
        user.setPasswordHash(passwordEncoder.encode(admin.password()));
        user.setRole(UserRole.ADMIN);
        user.setWallet(admin.wallet());
        User savedUser = userRepository.save(user);

        log.info("Admin account created: userId={}, username={}", savedUser.getId(), savedUser.getUsername());
        return true;
    }
}
