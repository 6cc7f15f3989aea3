package com.geekhub.collector.repository;

import com.geekhub.collector.entity.FetchStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface FetchStatusRepository extends JpaRepository<FetchStatus, Long> {

    List<FetchStatus> findByNextFetchAtLessThanEqual(LocalDateTime now);
}
