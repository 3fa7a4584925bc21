package com.chainbills.ledger.repository;

import com.chainbills.ledger.entity.Payable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import javax.persistence.LockModeType;
import java.util.Optional;

/**
 * Payables keyed by their 32-byte hex id.
 */
public interface PayableRepository extends JpaRepository<Payable, String> {

    /**
     * Loads a payable with a row lock held until the surrounding transaction ends,
     * so two operations on the same payable never interleave.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from Payable p where p.id = :id")
    Optional<Payable> findForUpdate(@Param("id") String id);
}
