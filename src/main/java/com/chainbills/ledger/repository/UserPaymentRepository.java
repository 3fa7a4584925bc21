package com.chainbills.ledger.repository;

import com.chainbills.ledger.entity.UserPayment;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UserPaymentRepository extends JpaRepository<UserPayment, String> {
}
