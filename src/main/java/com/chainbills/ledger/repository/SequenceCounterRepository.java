package com.chainbills.ledger.repository;

import com.chainbills.ledger.entity.CounterScope;
import com.chainbills.ledger.entity.SequenceCounter;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import javax.persistence.LockModeType;
import java.util.Optional;

public interface SequenceCounterRepository extends JpaRepository<SequenceCounter, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from SequenceCounter c where c.scope = :scope and c.scopeId = :scopeId")
    Optional<SequenceCounter> findForUpdate(@Param("scope") CounterScope scope, @Param("scopeId") String scopeId);

    Optional<SequenceCounter> findByScopeAndScopeId(CounterScope scope, String scopeId);
}
