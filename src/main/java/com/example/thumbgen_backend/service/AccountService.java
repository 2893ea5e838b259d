package com.example.thumbgen_backend.service;

import com.example.thumbgen_backend.exception.ThumbnailException;
import com.example.thumbgen_backend.model.Account;
import com.example.thumbgen_backend.repository.AccountRepository;
import jakarta.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AccountService {
    private static final Logger LOGGER = LoggerFactory.getLogger(AccountService.class);

    private final AccountRepository accountRepo;

    public AccountService(AccountRepository accountRepo) {
        this.accountRepo = accountRepo;
    }

    @Transactional
    public Account ensureByExternalSubject(String externalSubject, @Nullable String displayName) {
        var normalized = normalize(externalSubject);
        return accountRepo.findByExternalSubject(normalized)
                .orElseGet(() -> {
                    LOGGER.info("ACCOUNT created externalSubject={}", normalized);
                    return accountRepo.save(new Account(normalized, displayName != null ? displayName : "User"));
                });
    }

    @Transactional(readOnly = true)
    public Account getByExternalSubjectOrThrow(String externalSubject) {
        return accountRepo.findByExternalSubject(normalize(externalSubject))
                .orElseThrow(() -> ThumbnailException.notFound("OWNER_NOT_FOUND"));
    }

    private static String normalize(String externalSubject) {
        if (externalSubject == null || externalSubject.isBlank()) {
            throw ThumbnailException.invalid("OWNER_REQUIRED");
        }
        return externalSubject.trim();
    }
}
