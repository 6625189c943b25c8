package com.hospital.opd.repository;

import com.hospital.opd.entity.Token;
import com.hospital.opd.entity.TokenStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface TokenRepository extends JpaRepository<Token, Long> {

    Optional<Token> findByTokenId(String tokenId);

    List<Token> findBySlotIdAndStatusIn(String slotId, Collection<TokenStatus> statuses);

    List<Token> findBySlotIdOrderByTokenNumberAsc(String slotId);

    long countBySlotIdAndStatusIn(String slotId, Collection<TokenStatus> statuses);

    boolean existsBySlotIdAndPatientIdAndStatusIn(String slotId, String patientId, Collection<TokenStatus> statuses);

    List<Token> findByPatientIdOrderByCreatedAtDesc(String patientId);
}
