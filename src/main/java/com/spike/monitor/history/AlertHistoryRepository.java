package com.spike.monitor.history;

import com.spike.monitor.alert.AlertLevel;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for alert history entries.
 */
@Repository
public interface AlertHistoryRepository extends JpaRepository<AlertHistoryEntity, String> {

    List<AlertHistoryEntity> findAllByOrderByDispatchedAtAscAlertIdAsc();

    List<AlertHistoryEntity> findAllByOrderByDispatchedAtDescAlertIdDesc(Pageable pageable);

    List<AlertHistoryEntity> findByResolvedFalseOrderByDispatchedAtDescAlertIdDesc();

    List<AlertHistoryEntity> findByDispatchedAtGreaterThanEqualOrderByDispatchedAtDescAlertIdDesc(Instant since);

    List<AlertHistoryEntity> findByLevelAndDispatchedAtGreaterThanEqualOrderByDispatchedAtDescAlertIdDesc(
            AlertLevel level, Instant since);

    long countByResolvedFalse();

    long countByLevel(AlertLevel level);

    /** One {@code [alertId, reason]} row per stored reason line. */
    @Query("SELECT a.alertId, r FROM AlertHistoryEntity a JOIN a.reasons r")
    List<Object[]> findAlertReasons();

    @Query("SELECT a FROM AlertHistoryEntity a WHERE a.dispatchedAt < :cutoff")
    List<AlertHistoryEntity> findDispatchedBefore(@Param("cutoff") Instant cutoff);
}
