package com.chainbills.ledger.repository;

import com.chainbills.ledger.entity.ChainStats;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import javax.persistence.LockModeType;
import java.util.Optional;

public interface ChainStatsRepository extends JpaRepository<ChainStats, Integer> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select cs from ChainStats cs where cs.chainId = :chainId")
    Optional<ChainStats> findForUpdate(@Param("chainId") int chainId);
}
