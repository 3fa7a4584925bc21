package com.chainbills.ledger.repository;

import com.chainbills.ledger.entity.PayablePayment;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PayablePaymentRepository extends JpaRepository<PayablePayment, String> {
}
