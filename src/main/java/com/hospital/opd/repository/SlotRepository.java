package com.hospital.opd.repository;

import com.hospital.opd.entity.Slot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface SlotRepository extends JpaRepository<Slot, Long> {

    Optional<Slot> findBySlotId(String slotId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Slot s WHERE s.slotId = :slotId")
    Optional<Slot> findBySlotIdForUpdate(@Param("slotId") String slotId);

    List<Slot> findByDoctorIdAndDateAndStatusAndDeletedFalseOrderByStartTimeAsc(
            String doctorId,
            LocalDate date,
            Slot.Status status
    );

    List<Slot> findBySpecialtyIgnoreCaseAndDateAndStatusAndDeletedFalseOrderByStartTimeAsc(
            String specialty,
            LocalDate date,
            Slot.Status status
    );

    List<Slot> findByDoctorIdAndDateBetweenAndStatusAndDeletedFalseOrderByDateAscStartTimeAsc(
            String doctorId,
            LocalDate from,
            LocalDate to,
            Slot.Status status
    );

    List<Slot> findBySpecialtyIgnoreCaseAndDateBetweenAndStatusAndDeletedFalseOrderByDateAscStartTimeAsc(
            String specialty,
            LocalDate from,
            LocalDate to,
            Slot.Status status
    );

    List<Slot> findByDoctorIdAndDateBetweenAndDeletedFalseOrderByDateAscStartTimeAsc(
            String doctorId,
            LocalDate from,
            LocalDate to
    );

    List<Slot> findByDateBetweenAndDeletedFalseOrderByDateAscStartTimeAsc(
            LocalDate from,
            LocalDate to
    );
}
