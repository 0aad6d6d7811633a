package com.example.summarizer_backend.repository;

import com.example.summarizer_backend.model.SummaryJob;
import com.example.summarizer_backend.util.JobStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SummaryJobRepository extends JpaRepository<SummaryJob, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select j from SummaryJob j where j.id = :id")
    Optional<SummaryJob> findForUpdateById(@Param("id") UUID id);

    @Query("select j.id from SummaryJob j where j.status = :status order by j.createdAt asc")
    List<UUID> findIdsByStatusOldestFirst(@Param("status") JobStatus status, Pageable page);

    List<SummaryJob> findByStatus(JobStatus status);

    List<SummaryJob> findBySourceKeyOrderByCreatedAtDesc(String sourceKey);
}
