package com.geekhub.collector.repository;

import com.geekhub.collector.entity.FetchLogEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FetchLogRepository extends JpaRepository<FetchLogEntry, Long> {

    List<FetchLogEntry> findByFeedIdOrderByTimestampDescIdDesc(Long feedId, Pageable pageable);

    List<FetchLogEntry> findByUrlHashOrderByTimestampDescIdDesc(String urlHash, Pageable pageable);
}
