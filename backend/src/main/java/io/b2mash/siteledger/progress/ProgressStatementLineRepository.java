package io.b2mash.siteledger.progress;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProgressStatementLineRepository
    extends JpaRepository<ProgressStatementLine, UUID> {

  @Query(
      """
      SELECT l FROM ProgressStatementLine l
      WHERE l.statementId = :statementId
      ORDER BY l.createdAt
      """)
  List<ProgressStatementLine> findByStatementId(@Param("statementId") UUID statementId);
}
