package com.geekhub.collector.repository;

import com.geekhub.collector.entity.FetchHistory;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FetchHistoryRepository extends JpaRepository<FetchHistory, Long> {

    List<FetchHistory> findByFeedIdOrderByFetchedAtDesc(Long feedId, Pageable pageable);
}
