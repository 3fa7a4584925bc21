package com.chainbills.ledger.repository;

import com.chainbills.ledger.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import javax.persistence.LockModeType;
import java.util.Optional;

public interface UserRepository extends JpaRepository<User, Long> {

    Optional<User> findByChainIdAndWallet(int chainId, String wallet);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select u from User u where u.chainId = :chainId and u.wallet = :wallet")
    Optional<User> findForUpdate(@Param("chainId") int chainId, @Param("wallet") String wallet);
}
