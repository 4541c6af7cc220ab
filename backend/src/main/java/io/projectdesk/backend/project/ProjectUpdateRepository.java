package io.projectdesk.backend.project;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProjectUpdateRepository extends JpaRepository<ProjectUpdate, UUID> {

  List<ProjectUpdate> findByProjectIdOrderByCreatedAtDesc(UUID projectId);

  @Modifying
  @Query("DELETE FROM ProjectUpdate u WHERE u.authorId = :authorId")
  int deleteByAuthorId(@Param("authorId") UUID authorId);
}
