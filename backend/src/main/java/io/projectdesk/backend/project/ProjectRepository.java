package io.projectdesk.backend.project;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProjectRepository extends JpaRepository<Project, UUID> {

  @Query("SELECT p FROM Project p ORDER BY p.createdAt DESC")
  List<Project> findAllOrdered();

  @Query("SELECT p FROM Project p WHERE p.supervisorId = :userId ORDER BY p.createdAt DESC")
  List<Project> findBySupervisorId(@Param("userId") UUID userId);

  @Query(
      """
      SELECT DISTINCT p FROM Project p
      WHERE :userId MEMBER OF p.studentIds OR :userId MEMBER OF p.collaboratorIds
      ORDER BY p.createdAt DESC
      """)
  List<Project> findByMember(@Param("userId") UUID userId);

  boolean existsBySupervisorId(UUID supervisorId);
}
