package io.projectdesk.backend.billing;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RedirectFlowRepository extends JpaRepository<RedirectFlow, UUID> {

  Optional<RedirectFlow> findByFlowIdAndUserId(String flowId, UUID userId);

  @Modifying
  @Query("DELETE FROM RedirectFlow f WHERE f.userId = :userId AND f.completedAt IS NULL")
  int deletePendingByUserId(@Param("userId") UUID userId);

  @Modifying
  @Query("DELETE FROM RedirectFlow f WHERE f.userId = :userId")
  int deleteByUserId(@Param("userId") UUID userId);
}
