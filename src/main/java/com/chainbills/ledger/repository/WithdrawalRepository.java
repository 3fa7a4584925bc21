package com.chainbills.ledger.repository;

import com.chainbills.ledger.entity.Withdrawal;
import org.springframework.data.jpa.repository.JpaRepository;

public interface WithdrawalRepository extends JpaRepository<Withdrawal, String> {
}
