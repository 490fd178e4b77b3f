package com.duelo.repository;

import com.duelo.entity.UserCreditBalance;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for managing {@link UserCreditBalance} rows.
 */
public interface UserCreditBalanceRepository extends JpaRepository<UserCreditBalance, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select b from UserCreditBalance b where b.userId = :userId")
    Optional<UserCreditBalance> findByUserIdForUpdate(@Param("userId") UUID userId);
}
