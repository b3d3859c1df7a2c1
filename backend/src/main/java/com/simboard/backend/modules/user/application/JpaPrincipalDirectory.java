package com.simboard.backend.modules.user.application;

import java.util.Optional;
import java.util.UUID;

import com.simboard.backend.modules.user.domain.AppUser;
import com.simboard.backend.modules.user.domain.Principal;
import com.simboard.backend.modules.user.infrastructure.persistence.AppUserRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class JpaPrincipalDirectory implements PrincipalDirectory {

    private final AppUserRepository appUserRepository;

    public JpaPrincipalDirectory(AppUserRepository appUserRepository) {
        this.appUserRepository = appUserRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Principal> findById(UUID id) {
        if (id == null) {
            return Optional.empty();
        }
        return appUserRepository.findById(id).map(AppUser::toPrincipal);
    }
}
