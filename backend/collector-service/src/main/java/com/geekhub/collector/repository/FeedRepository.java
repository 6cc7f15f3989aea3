package com.geekhub.collector.repository;

import com.geekhub.collector.entity.Feed;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface FeedRepository extends JpaRepository<Feed, Long> {

    List<Feed> findByActiveTrue();

    Optional<Feed> findByUrlHash(String urlHash);
}
