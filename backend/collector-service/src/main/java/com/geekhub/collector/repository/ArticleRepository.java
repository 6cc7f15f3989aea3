package com.geekhub.collector.repository;

import com.geekhub.collector.entity.Article;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ArticleRepository extends JpaRepository<Article, Long> {

    boolean existsByFeedIdAndHash(Long feedId, String hash);

    Optional<Article> findByFeedIdAndHash(Long feedId, String hash);

    Page<Article> findByFeedIdOrderByPublishedAtDesc(Long feedId, Pageable pageable);

    long countByFeedId(Long feedId);
}
