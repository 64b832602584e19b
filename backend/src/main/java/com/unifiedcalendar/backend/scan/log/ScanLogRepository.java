package com.unifiedcalendar.backend.scan.log;

import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public interface ScanLogRepository extends JpaRepository<ScanLog, Long> {

    List<ScanLog> findAllByOrderByIdDesc(Pageable pageable);

    List<ScanLog> findByAccountIdOrderByIdDesc(String accountId, Pageable pageable);

    @Query("SELECT s.id FROM ScanLog s ORDER BY s.id DESC")
    List<Long> findIdsNewestFirst(Pageable pageable);

    @Transactional
    long deleteByIdLessThan(Long id);
}
