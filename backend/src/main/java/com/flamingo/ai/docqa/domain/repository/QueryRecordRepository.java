package com.flamingo.ai.docqa.domain.repository;

import com.flamingo.ai.docqa.domain.entity.QueryRecord;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for the append-only query log. */
@Repository
public interface QueryRecordRepository extends JpaRepository<QueryRecord, UUID> {

  /** Finds the newest records first. */
  List<QueryRecord> findAllByOrderByCreatedAtDesc(Pageable pageable);
}
