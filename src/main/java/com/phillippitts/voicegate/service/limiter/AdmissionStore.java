package com.phillippitts.voicegate.service.limiter;

import com.phillippitts.voicegate.domain.AdmissionRecord;

import java.util.Optional;

/**
 * Persistence port for per-identity admission records.
 *
 * <p>Methods throw {@link org.springframework.dao.DataAccessException} on store failures.
 * {@link #findForUpdate(String)} must hold a row lock until the surrounding transaction ends;
 * that row lock is the only serialization point for concurrent admissions of one identity.
 */
public interface AdmissionStore {

    Optional<AdmissionRecord> find(String identityKey);

    Optional<AdmissionRecord> findForUpdate(String identityKey);

    /**
     * @throws org.springframework.dao.DuplicateKeyException when a concurrent first visit won
     */
    void insert(AdmissionRecord record);

    void update(AdmissionRecord record);

    /** @return true when a row exists for the identity */
    boolean releaseLock(String identityKey);
}
