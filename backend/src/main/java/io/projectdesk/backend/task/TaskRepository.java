package io.projectdesk.backend.task;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskRepository extends JpaRepository<Task, UUID> {

  @Query("SELECT t FROM Task t WHERE t.projectId = :projectId ORDER BY t.createdAt ASC")
  List<Task> findByProjectId(@Param("projectId") UUID projectId);

  @Query(
      """
      SELECT t FROM Task t
      WHERE t.projectId = :projectId
        AND t.status <> io.projectdesk.backend.task.TaskStatus.COMPLETE
      ORDER BY t.createdAt ASC
      """)
  List<Task> findOutstandingByProjectId(@Param("projectId") UUID projectId);

  boolean existsByProjectIdAndTitleIgnoreCase(UUID projectId, String title);

  boolean existsByProjectIdAndTitleIgnoreCaseAndIdNot(UUID projectId, String title, UUID id);

  @Query("SELECT t FROM Task t WHERE :userId MEMBER OF t.assigneeIds")
  List<Task> findByAssignee(@Param("userId") UUID userId);

  @Modifying(flushAutomatically = true)
  @Query(
      """
      UPDATE Task t SET t.flagged = false, t.flaggedBy = NULL
      WHERE t.flaggedBy = :userId
      """)
  int clearFlagsRaisedBy(@Param("userId") UUID userId);
}
